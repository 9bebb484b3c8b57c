package com.nexus.resolution.rules;

import com.nexus.resolution.core.model.EntityType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should strip organization suffixes")
    @CsvSource({
            "Costco Wholesale Corporation,costco wholesale",
            "Costco Wholesale Corp.,costco wholesale",
            "'Costco Wholesale, Inc.',costco wholesale",
            "Apple Incorporated,apple",
            "Google LLC,google",
            "Amazon.com Ltd,amazon com",
            "Tesla Company,tesla",
            "Volkswagen AG,volkswagen",
            "Siemens GmbH,siemens",
            "Royal Dutch Shell N.V.,royal dutch shell"
    })
    void testOrganizationSuffixes(String input, String expected) {
        assertEquals(expected, engine.normalize(input, EntityType.ORGANIZATION));
    }

    @Test
    @DisplayName("Organization rules should not touch person names")
    void testSuffixRulesAreTypeScoped() {
        assertEquals("jean marc co", engine.normalize("Jean-Marc Co", EntityType.PERSON));
        assertEquals("jean marc", engine.normalize("Jean-Marc Co", EntityType.ORGANIZATION));
    }

    @Test
    @DisplayName("Should remove the leading article from organization names")
    void testThePrefix() {
        assertEquals("coca cola", engine.normalize("The Coca-Cola", EntityType.ORGANIZATION));
    }

    @Test
    @DisplayName("Should fold diacritics before applying rules")
    void testDiacriticFolding() {
        assertEquals("marie eve girard", engine.normalize("Marie-Ève Girard", EntityType.PERSON));
        assertEquals("francois lefevre", engine.normalize("François Lefèvre", EntityType.PERSON));
        assertEquals("Zoe", NormalizationEngine.foldDiacritics("Zoë"));
    }

    @Test
    @DisplayName("Should strip honorifics and generational suffixes from people")
    void testPersonRules() {
        assertEquals("jane smith", engine.normalize("Dr. Jane Smith Jr.", EntityType.PERSON));
        assertEquals("louise roy", engine.normalize("Mme Louise Roy", EntityType.PERSON));
    }

    @Test
    @DisplayName("Should normalize 'and' and ampersand")
    void testAndNormalization() {
        assertEquals("procter gamble", engine.normalize("Procter & Gamble", EntityType.ORGANIZATION));
        assertEquals("procter gamble", engine.normalize("Procter and Gamble", EntityType.ORGANIZATION));
    }

    @Test
    @DisplayName("Null type applies only unscoped rules")
    void testNullTypeSkipsScopedRules() {
        assertEquals("acme corp", engine.normalize("ACME   Corp."));
    }

    @Test
    @DisplayName("Should report equivalence after normalization")
    void testAreEquivalent() {
        assertTrue(engine.areEquivalent("Costco Wholesale Corporation", "costco wholesale", EntityType.ORGANIZATION));
        assertFalse(engine.areEquivalent("Costco", "Walmart", EntityType.ORGANIZATION));
    }

    @Test
    @DisplayName("Rules should run in priority order and be removable")
    void testCustomRules() {
        NormalizationEngine custom = new NormalizationEngine(List.of(
                NormalizationRule.builder().name("second").pattern("b").replacement("c").priority(20).build(),
                NormalizationRule.builder().name("first").pattern("a").replacement("b").priority(10).build()
        ));
        assertEquals("cc", custom.normalize("ab"));
        assertEquals("first", custom.getRules().get(0).getName());

        assertTrue(custom.removeRule("second"));
        assertEquals("bb", custom.normalize("ab"));
        assertFalse(custom.removeRule("missing"));
    }

    @Test
    @DisplayName("Scoped rules should only apply to their entity types")
    void testScopedRule() {
        NormalizationRule dropDr = NormalizationRule.builder()
                .name("drop-dr").pattern("^dr\\.?\\s+").applicableTypes(EntityType.PERSON).build();
        NormalizationEngine custom = new NormalizationEngine(List.of(dropDr));

        assertFalse(dropDr.isUnscoped());
        assertEquals("jane doe", custom.normalize("Dr. Jane Doe", EntityType.PERSON));
        assertEquals("dr. jane doe", custom.normalize("Dr. Jane Doe", EntityType.ORGANIZATION));
        assertEquals("dr. jane doe", custom.normalize("Dr. Jane Doe"));
    }
}
