package com.williamcallahan.scormingest.domain.manifest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ScoTest {

    @Test
    void contentPathDropsQueryAndFragment() {
        assertEquals("page.html", new Sco("id", "Title", "page.html?quiz=1").contentPath());
        assertEquals("dir/page.html", new Sco("id", "Title", "dir/page.html#start").contentPath());
        assertEquals("page.htm", new Sco("id", "Title", "page.htm#a?b=c").contentPath());
        assertEquals("plain.html", new Sco("id", "Title", "plain.html").contentPath());
    }

    @Test
    void requiresIdentifierAndTitle() {
        assertThrows(NullPointerException.class, () -> new Sco(null, "Title", "a.html"));
        assertThrows(NullPointerException.class, () -> new Sco("id", null, "a.html"));
    }

    @Test
    void missingHrefHasEmptyContentPath() {
        Sco withoutHref = new Sco("id", "Title", null);
        Sco blankHref = new Sco("id", "Title", "  ");

        assertFalse(withoutHref.hasHref());
        assertFalse(blankHref.hasHref());
        assertTrue(new Sco("id", "Title", "a.html").hasHref());
        assertEquals("", withoutHref.contentPath());
        assertEquals("", blankHref.contentPath());
    }

    @Test
    void courseManifestDefaultsTitleAndCopiesScos() {
        List<Sco> scos = new ArrayList<>(List.of(new Sco("a", "A", "a.html")));
        CourseManifest courseManifest = new CourseManifest("  ", scos);
        scos.clear();

        assertEquals(CourseManifest.UNTITLED_COURSE, courseManifest.courseTitle());
        assertEquals(1, courseManifest.scos().size());
        assertEquals("a", courseManifest.firstSco().orElseThrow().identifier());
    }
}
