package com.waterfront.listings.crawl.listing;

import com.waterfront.listings.crawl.resolve.FieldDefinitions;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WaterfrontClassifierTest {
    private final WaterfrontClassifier classifier =
        new WaterfrontClassifier(FieldDefinitions.defaults().descriptionKeywords());

    @Test
    void noSignalsMeansNotOnTheWater() {
        WaterfrontClassifier.Classification result =
            classifier.classify(null, null, null, "Updated kitchen and a two car garage.");
        assertFalse(result.waterfront());
        assertNull(result.type());
    }

    @Test
    void mostSpecificWaterTypeWins() {
        assertEquals("intracoastal", classifier.classify("Intracoastal, Ocean Access", null, null, null).type());
        assertEquals("canal", classifier.classify(null, "Canal", null, null).type());
        assertEquals("lake", classifier.classify(null, null, "Lake Minnetonka", null).type());
    }

    @Test
    void structuredSignalsBeatDescriptionKeywords() {
        WaterfrontClassifier.Classification result =
            classifier.classify("Bay Front", null, null, "Minutes to the ocean and the river walk.");
        assertEquals("bay", result.type());
    }

    @Test
    void viewOnlyListingIsWaterView() {
        WaterfrontClassifier.Classification result = classifier.classify(null, "Yes", null, null);
        assertTrue(result.waterfront());
        assertEquals(WaterfrontClassifier.TYPE_WATER_VIEW, result.type());
    }

    @Test
    void negativeViewValuesAreIgnored() {
        assertFalse(classifier.classify(null, "None", null, null).waterfront());
        assertFalse(classifier.classify("[]", "false", "", null).waterfront());
    }

    @Test
    void accessOnlyWhenOnlyAccessIsMentioned() {
        WaterfrontClassifier.Classification result = classifier.classify("Deeded Water Access", null, null, null);
        assertTrue(result.waterfront());
        assertEquals(WaterfrontClassifier.TYPE_ACCESS_ONLY, result.type());
    }

    @Test
    void keywordOnlyListingGetsGenericTag() {
        WaterfrontClassifier.Classification result =
            classifier.classify(null, null, null, "Stunning waterfront estate with room for guests.");
        assertTrue(result.waterfront());
        assertEquals(WaterfrontClassifier.TYPE_GENERIC, result.type());
    }

    @Test
    void keywordsMatchWholeWordsOnly() {
        assertFalse(classifier.classify(null, null, null, "Freshly painted baywindow nook, docked pricing.").waterfront());
    }
}
