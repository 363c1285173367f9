package com.williamcallahan.scormingest.service.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.scormingest.domain.manifest.CourseManifest;
import com.williamcallahan.scormingest.domain.manifest.ManifestError;
import com.williamcallahan.scormingest.domain.manifest.ManifestErrorCode;
import com.williamcallahan.scormingest.domain.manifest.Sco;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies SCO derivation, organization selection and error reporting for package manifests.
 */
class ManifestParserTest {

    private static final String MANIFEST_OPEN = """
            <?xml version="1.0" encoding="UTF-8"?>
            <manifest identifier="test" xmlns="http://www.imsglobal.org/xsd/imscp_v1p1"
                      xmlns:adlcp="http://www.adlnet.org/xsd/adlcp_v1p3">
            """;

    @TempDir
    Path packageDir;

    private final ManifestParser manifestParser = new ManifestParser(new ManifestElementReader());

    @Test
    void parsesGolfSampleInDocumentOrder() throws URISyntaxException {
        Path golfDir = Path.of(ManifestParserTest.class.getResource("/scorm/golf").toURI());

        CourseManifest courseManifest = parsedManifest(golfDir);

        assertEquals("Golf Explained - Minimum Run-time Calls", courseManifest.courseTitle());
        assertEquals(15, courseManifest.scos().size());
        Sco first = courseManifest.scos().get(0);
        assertEquals("playing_playing_item", first.identifier());
        assertEquals("How to Play", first.title());
        assertEquals("Playing/Playing.html", first.href());

        List<String> identifiers = courseManifest.scos().stream().map(Sco::identifier).toList();
        assertFalse(identifiers.contains("glossary_item"), "asset items must be excluded");
        assertFalse(identifiers.contains("resources_item"), "asset items must be excluded");
        assertFalse(identifiers.contains("playing_quiz_item"), "quiz template is an asset");
        assertFalse(identifiers.contains("playing_item"), "navigation-only items must be excluded");

        Sco last = courseManifest.scos().get(14);
        assertEquals("exam_part1_item", last.identifier());
        assertEquals("shared/launchpage.html?content=exam", last.href());
        assertEquals("shared/launchpage.html", last.contentPath());
    }

    @Test
    void collectsScosFromDeeplyNestedItemsInDocumentOrder() throws IOException {
        writeManifest(MANIFEST_OPEN + """
                  <organizations>
                    <organization identifier="org">
                      <title>Nested</title>
                      <item identifier="level1">
                        <title>Level 1</title>
                        <item identifier="level2" identifierref="res_a">
                          <title>A</title>
                          <item identifier="level3">
                            <item identifier="level4" identifierref="res_b">
                              <title>B</title>
                              <item identifier="level5" identifierref="res_asset"><title>Asset</title></item>
                            </item>
                          </item>
                        </item>
                      </item>
                      <item identifier="sibling" identifierref="res_c"><title>C</title></item>
                    </organization>
                  </organizations>
                  <resources>
                    <resource identifier="res_a" type="webcontent" adlcp:scormType="sco" href="a.html"/>
                    <resource identifier="res_b" type="webcontent" adlcp:scormType="sco" href="b.html"/>
                    <resource identifier="res_c" type="webcontent" adlcp:scormType="sco" href="c.html"/>
                    <resource identifier="res_asset" type="webcontent" adlcp:scormType="asset" href="asset.html"/>
                  </resources>
                </manifest>
                """);

        CourseManifest courseManifest = parsedManifest(packageDir);

        assertEquals(List.of("level2", "level4", "sibling"),
                courseManifest.scos().stream().map(Sco::identifier).toList());
        assertEquals(List.of("a.html", "b.html", "c.html"),
                courseManifest.scos().stream().map(Sco::href).toList());
    }

    @Test
    void acceptsScormTypeUnderAnyPrefixOrCase() throws IOException {
        writeManifest("""
                <?xml version="1.0"?>
                <manifest identifier="scorm12" xmlns:adl="http://www.adlnet.org/xsd/adlcp_rootv1p2">
                  <organizations default="org">
                    <organization identifier="org">
                      <title>SCORM 1.2 Course</title>
                      <item identifier="lower" identifierref="res_lower"><title>Lower</title></item>
                      <item identifier="plain" identifierref="res_plain"><title>Plain</title></item>
                      <item identifier="upper" identifierref="res_upper"><title>Upper</title></item>
                      <item identifier="untyped" identifierref="res_untyped"><title>Untyped</title></item>
                    </organization>
                  </organizations>
                  <resources>
                    <resource identifier="res_lower" type="webcontent" adl:scormtype="sco" href="lower.html"/>
                    <resource identifier="res_plain" type="webcontent" scormType="sco" href="plain.html"/>
                    <resource identifier="res_upper" type="webcontent" adl:scormType="SCO" href="upper.html"/>
                    <resource identifier="res_untyped" type="webcontent" href="untyped.html"/>
                  </resources>
                </manifest>
                """);

        CourseManifest courseManifest = parsedManifest(packageDir);

        assertEquals(List.of("lower", "plain", "upper"),
                courseManifest.scos().stream().map(Sco::identifier).toList());
    }

    @Test
    void honoursDefaultOrganization() throws IOException {
        writeManifest(MANIFEST_OPEN + """
                  <organizations default="second">
                    <organization identifier="first">
                      <title>First Organization</title>
                      <item identifier="first_item" identifierref="res"><title>First</title></item>
                    </organization>
                    <organization identifier="second">
                      <title>Second Organization</title>
                      <item identifier="second_item" identifierref="res"><title>Second</title></item>
                    </organization>
                  </organizations>
                  <resources>
                    <resource identifier="res" type="webcontent" adlcp:scormType="sco" href="index.html"/>
                  </resources>
                </manifest>
                """);

        CourseManifest courseManifest = parsedManifest(packageDir);

        assertEquals("Second Organization", courseManifest.courseTitle());
        assertEquals("second_item", courseManifest.scos().get(0).identifier());
    }

    @Test
    void fallsBackForMissingTitlesAndIdentifiers() throws IOException {
        writeManifest(MANIFEST_OPEN + """
                  <organizations>
                    <organization identifier="org">
                      <item identifier="untitled_item" identifierref="res_one"/>
                      <item identifierref="res_two"/>
                    </organization>
                  </organizations>
                  <resources>
                    <resource identifier="res_one" adlcp:scormType="sco" href="  one.html  "/>
                    <resource identifier="res_two" adlcp:scormType="sco" href="two.html"/>
                  </resources>
                </manifest>
                """);

        CourseManifest courseManifest = parsedManifest(packageDir);

        assertEquals(CourseManifest.UNTITLED_COURSE, courseManifest.courseTitle());
        assertEquals(new Sco("untitled_item", "untitled_item", "one.html"), courseManifest.scos().get(0));
        assertEquals(new Sco("", ManifestParser.UNTITLED_SCO, "two.html"), courseManifest.scos().get(1));
    }

    @Test
    void keepsScoResourcesWithoutHrefAndFirstDuplicateResource() throws IOException {
        writeManifest(MANIFEST_OPEN + """
                  <organizations>
                    <organization identifier="org">
                      <title>Course</title>
                      <item identifier="no_href" identifierref="res_no_href"><title>No href</title></item>
                      <item identifier="dup" identifierref="res_dup"><title>Duplicate</title></item>
                      <item identifier="dangling" identifierref="missing"><title>Dangling</title></item>
                    </organization>
                  </organizations>
                  <resources>
                    <resource identifier="res_no_href" adlcp:scormType="sco"/>
                    <resource identifier="res_dup" adlcp:scormType="sco" href="first.html"/>
                    <resource identifier="res_dup" adlcp:scormType="sco" href="second.html"/>
                  </resources>
                </manifest>
                """);

        CourseManifest courseManifest = parsedManifest(packageDir);

        assertEquals(List.of("no_href", "dup"), courseManifest.scos().stream().map(Sco::identifier).toList());
        assertNull(courseManifest.scos().get(0).href());
        assertFalse(courseManifest.scos().get(0).hasHref());
        assertEquals("first.html", courseManifest.scos().get(1).href());
    }

    @Test
    void manifestWithoutOrganizationsHasNoScos() throws IOException {
        writeManifest(MANIFEST_OPEN + """
                  <resources>
                    <resource identifier="res" adlcp:scormType="sco" href="index.html"/>
                  </resources>
                </manifest>
                """);

        CourseManifest courseManifest = parsedManifest(packageDir);

        assertEquals(CourseManifest.UNTITLED_COURSE, courseManifest.courseTitle());
        assertTrue(courseManifest.scos().isEmpty());
    }

    @Test
    void reportsMissingManifest() {
        ManifestError error = failedManifest(packageDir);

        assertEquals(ManifestErrorCode.MANIFEST_NOT_FOUND, error.code());
        assertEquals("Manifest file (imsmanifest.xml) not found in the package", error.message());
    }

    @Test
    void reportsMalformedXml() throws IOException {
        writeManifest("<manifest><organizations></manifest>");

        ManifestError error = failedManifest(packageDir);

        assertEquals(ManifestErrorCode.MALFORMED_XML, error.code());
        assertTrue(error.message().startsWith("Failed to parse manifest XML: "));
    }

    @Test
    void reportsUnexpectedRootElement() throws IOException {
        writeManifest("<?xml version=\"1.0\"?><package><organizations/></package>");

        ManifestError error = failedManifest(packageDir);

        assertEquals(ManifestErrorCode.INVALID_MANIFEST_ROOT, error.code());
        assertTrue(error.message().contains("<package>"));
    }

    @Test
    void rejectsNestingBeyondDepthLimit() throws IOException {
        int depth = ManifestElementReader.MAX_DEPTH + 20;
        StringBuilder xml = new StringBuilder("<manifest><organizations><organization identifier=\"org\">");
        xml.append("<item>".repeat(depth));
        xml.append("</item>".repeat(depth));
        xml.append("</organization></organizations></manifest>");
        writeManifest(xml.toString());

        ManifestError error = failedManifest(packageDir);

        assertEquals(ManifestErrorCode.MALFORMED_XML, error.code());
        assertTrue(error.message().contains("nesting exceeds"));
    }

    @Test
    void parsingTwiceYieldsEqualManifests() throws URISyntaxException {
        Path golfDir = Path.of(ManifestParserTest.class.getResource("/scorm/golf").toURI());

        assertEquals(parsedManifest(golfDir), parsedManifest(golfDir));
    }

    private CourseManifest parsedManifest(Path extractedDir) {
        ManifestParseOutcome outcome = manifestParser.parse(extractedDir);
        assertTrue(outcome.manifest().isPresent(), () -> "Expected a parsed manifest but got " + outcome);
        return outcome.manifest().get();
    }

    private ManifestError failedManifest(Path extractedDir) {
        ManifestParseOutcome outcome = manifestParser.parse(extractedDir);
        assertTrue(outcome.error().isPresent(), () -> "Expected a manifest error but got " + outcome);
        return outcome.error().get();
    }

    private void writeManifest(String xml) throws IOException {
        Files.writeString(packageDir.resolve(ManifestParser.MANIFEST_FILE_NAME), xml.strip(), StandardCharsets.UTF_8);
    }
}
