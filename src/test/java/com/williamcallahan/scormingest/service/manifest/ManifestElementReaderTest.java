package com.williamcallahan.scormingest.service.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies the manifest tree built from raw XML.
 */
class ManifestElementReaderTest {

    private final ManifestElementReader reader = new ManifestElementReader();

    @Test
    void keepsPrefixedAttributeNamesAndTrimmedText() throws MalformedManifestException {
        ManifestElement root = read("""
                <manifest xmlns="http://www.imsglobal.org/xsd/imscp_v1p1"
                          xmlns:adlcp="http://www.adlnet.org/xsd/adlcp_v1p3" identifier="m1">
                  <resources>
                    <resource identifier="r1" adlcp:scormType="sco" href="index.html"/>
                  </resources>
                  <title>
                     Course <![CDATA[One]]>
                  </title>
                </manifest>
                """);

        assertEquals("manifest", root.tagName());
        assertEquals("m1", root.attribute("identifier"));
        assertFalse(root.attributes().containsKey("xmlns"), "namespace declarations are not attributes");
        ManifestElement resource = root.firstChild("resources").orElseThrow().children("resource").get(0);
        assertEquals("sco", resource.attribute("adlcp:scormType"));
        assertNull(resource.attribute("scormType"));
        assertEquals(Optional.of("Course One"), root.firstChild("title").orElseThrow().text());
        assertTrue(root.text().isEmpty(), "whitespace-only text is dropped");
    }

    @Test
    void groupsChildrenByTagInDocumentOrder() throws MalformedManifestException {
        ManifestElement root = read("""
                <organization>
                  <item identifier="a"/>
                  <title>Org</title>
                  <item identifier="b"/>
                  <item identifier="c"/>
                </organization>
                """);

        List<String> itemIds = root.children("item").stream().map(item -> item.attribute("identifier")).toList();
        assertEquals(List.of("a", "b", "c"), itemIds);
        assertEquals(List.of("item", "title"), List.copyOf(root.children().keySet()));
        assertTrue(root.children("resource").isEmpty());
    }

    @Test
    void rejectsUnbalancedMarkup() {
        assertThrows(MalformedManifestException.class, () -> read("<manifest><item></manifest>"));
    }

    @Test
    void rejectsEmptyDocument() {
        assertThrows(MalformedManifestException.class, () -> read(""));
    }

    @Test
    void acceptsNestingAtTheDepthLimit() throws MalformedManifestException {
        int depth = ManifestElementReader.MAX_DEPTH;
        ManifestElement root = read("<item>".repeat(depth) + "</item>".repeat(depth));

        int levels = 1;
        ManifestElement current = root;
        while (current.firstChild("item").isPresent()) {
            current = current.firstChild("item").get();
            levels++;
        }
        assertEquals(depth, levels);
    }

    @Test
    void rejectsNestingBeyondTheDepthLimit() {
        int depth = ManifestElementReader.MAX_DEPTH + 1;
        MalformedManifestException thrown = assertThrows(MalformedManifestException.class,
                () -> read("<item>".repeat(depth) + "</item>".repeat(depth)));
        assertTrue(thrown.getMessage().contains(String.valueOf(ManifestElementReader.MAX_DEPTH)));
    }

    @Test
    void doesNotResolveExternalEntities(@TempDir Path tempDir) throws IOException {
        Path secretFile = tempDir.resolve("secret.txt");
        Files.writeString(secretFile, "top-secret-value", StandardCharsets.UTF_8);
        String xml = "<?xml version=\"1.0\"?>"
                + "<!DOCTYPE manifest [<!ENTITY xxe SYSTEM \"" + secretFile.toUri() + "\">]>"
                + "<manifest><title>&xxe;</title></manifest>";

        try {
            ManifestElement root = read(xml);
            String title = root.firstChild("title").flatMap(ManifestElement::text).orElse("");
            assertFalse(title.contains("top-secret-value"), "external entity must not be expanded");
        } catch (MalformedManifestException rejected) {
            assertNotNull(rejected.getMessage());
        }
    }

    @Test
    void readsFromFile(@TempDir Path tempDir) throws IOException, MalformedManifestException {
        Path manifest = tempDir.resolve("imsmanifest.xml");
        Files.writeString(manifest, "<manifest identifier=\"from-file\"/>", StandardCharsets.UTF_8);

        assertEquals("from-file", reader.read(manifest).attribute("identifier"));
    }

    private ManifestElement read(String xml) throws MalformedManifestException {
        return reader.read(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
