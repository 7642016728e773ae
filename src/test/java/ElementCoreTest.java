import org.eds.element.ChemicalElement;
import org.eds.element.ChemicalFormula;
import org.eds.element.ElementResolver;
import org.eds.element.ElementSpec;
import org.eds.element.PeriodicTable;
import org.eds.error.InvalidElementException;
import org.eds.io.TableSource;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for:
 * - PeriodicTable (bundled table + custom sources)
 * - ChemicalFormula
 * - ElementSpec labels and suffix handling
 * - ElementResolver
 */
public class ElementCoreTest {

    // ----------------------------
    // Helpers
    // ----------------------------

    private static final ElementResolver RESOLVER = new ElementResolver();

    private static List<String> labels(List<ElementSpec> specs) {
        List<String> out = new ArrayList<>();
        for (ElementSpec s : specs) out.add(s.label());
        return out;
    }

    private static TableSource<List<ChemicalElement>> source(List<ChemicalElement> rows) {
        return new TableSource<>() {
            @Override
            public String name() {
                return "inline";
            }

            @Override
            public List<ChemicalElement> load() {
                return rows;
            }
        };
    }

    // ----------------------------
    // PeriodicTable
    // ----------------------------

    @Nested
    class PeriodicTableTests {

        @Test
        void standard_isSingleton() {
            assertSame(PeriodicTable.standard(), PeriodicTable.standard());
        }

        @Test
        void standard_knowsIronBothWays() {
            PeriodicTable t = PeriodicTable.standard();
            ChemicalElement fe = t.requireSymbol("Fe");
            assertEquals(26, fe.z());
            assertEquals(55.845, fe.weight(), 0.01);
            assertEquals("Fe", t.requireZ(26).symbol());
        }

        @Test
        void unknownSymbolOrNumber_throwsInvalidElement() {
            PeriodicTable t = PeriodicTable.standard();
            assertThrows(InvalidElementException.class, () -> t.requireSymbol("Xx"));
            assertThrows(InvalidElementException.class, () -> t.requireZ(0));
            assertTrue(t.findZ(200).isEmpty());
            assertFalse(t.isSymbol("fe"));
        }

        @Test
        void customSource_duplicateSymbol_throws() {
            List<ChemicalElement> rows = List.of(
                    new ChemicalElement(1, "H", 1.008),
                    new ChemicalElement(2, "H", 4.0));
            assertThrows(IllegalArgumentException.class, () -> new PeriodicTable(source(rows)));
        }

        @Test
        void customSource_empty_throws() {
            assertThrows(IllegalArgumentException.class, () -> new PeriodicTable(source(List.of())));
        }
    }

    // ----------------------------
    // ChemicalFormula
    // ----------------------------

    @Nested
    class ChemicalFormulaTests {

        @Test
        void parse_countsAndFractions() {
            ChemicalFormula f = ChemicalFormula.parse("Fe2O3").orElseThrow();
            assertEquals(Map.of("Fe", 2.0, "O", 3.0), f.counts());
            assertEquals(0.4, f.atomicFractions().get("Fe"), 1e-12);
            assertEquals(0.6, f.atomicFractions().get("O"), 1e-12);
            assertTrue(f.isCompound());
        }

        @Test
        void parse_fractionalCounts() {
            ChemicalFormula f = ChemicalFormula.parse("Mg0.5Fe1.5SiO4").orElseThrow();
            assertEquals(0.5, f.counts().get("Mg"), 0.0);
            assertEquals(1.5, f.counts().get("Fe"), 0.0);
            assertEquals(1.0, f.counts().get("Si"), 0.0);
            assertEquals(4.0, f.counts().get("O"), 0.0);
        }

        @Test
        void singleSymbol_isNotCompound() {
            assertFalse(ChemicalFormula.parse("Fe").orElseThrow().isCompound());
            assertTrue(ChemicalFormula.parse("O2").orElseThrow().isCompound());
        }

        @Test
        void invalidText_returnsEmpty() {
            assertEquals(Optional.empty(), ChemicalFormula.parse("fe2o3"));
            assertEquals(Optional.empty(), ChemicalFormula.parse("Fe(OH)2"));
            assertEquals(Optional.empty(), ChemicalFormula.parse(" "));
            assertEquals(Optional.empty(), ChemicalFormula.parse(null));
        }
    }

    // ----------------------------
    // ElementSpec
    // ----------------------------

    @Nested
    class ElementSpecTests {

        @Test
        void labels_carrySplitSuffix() {
            assertEquals("Fe", ElementSpec.element("Fe").label());
            assertEquals("Fe_lo", new ElementSpec("Fe", ElementSpec.Kind.LOW_ENERGY_SPLIT).label());
            assertEquals("Fe_hi", new ElementSpec("Fe", ElementSpec.Kind.HIGH_ENERGY_SPLIT).label());
            assertEquals("Fe2O3", ElementSpec.compound("Fe2O3").label());
        }

        @Test
        void unsplit_dropsOnlySplitTag() {
            ElementSpec lo = new ElementSpec("Fe", ElementSpec.Kind.LOW_ENERGY_SPLIT);
            assertEquals(ElementSpec.element("Fe"), lo.unsplit());
            ElementSpec c = ElementSpec.compound("SiO2");
            assertSame(c, c.unsplit());
        }

        @Test
        void stripSuffix_onlyKnownSuffixes() {
            assertEquals("Fe", ElementSpec.stripSuffix("Fe_lo"));
            assertEquals("26", ElementSpec.stripSuffix("26_hi"));
            assertEquals("Fe_x", ElementSpec.stripSuffix("Fe_x"));
        }

        @Test
        void blankSymbol_throws() {
            assertThrows(IllegalArgumentException.class, () -> ElementSpec.element(" "));
            assertThrows(NullPointerException.class, () -> new ElementSpec("Fe", null));
        }
    }

    // ----------------------------
    // ElementResolver
    // ----------------------------

    @Nested
    class ResolverTests {

        @Test
        void mixedNumbersAndSymbols_resolveInOrder() {
            List<ElementSpec> out = RESOLVER.resolve(List.of(26, "O", "14"));
            assertEquals(List.of("Fe", "O", "Si"), labels(out));
        }

        @Test
        void duplicatesAfterSuffixStrip_areRemoved() {
            List<Object> raw = List.of("Fe_lo", "Fe_hi", 26, "O", "8", "Si");
            List<ElementSpec> out = RESOLVER.resolve(raw);
            assertEquals(List.of("Fe", "O", "Si"), labels(out));

            LinkedHashSet<String> stripped = new LinkedHashSet<>();
            for (String s : RESOLVER.toRowLabels(raw)) stripped.add(ElementSpec.stripSuffix(s));
            assertEquals(stripped.size(), out.size());
        }

        @Test
        void numericSplitLabel_resolvesWithTag() {
            ElementSpec s = RESOLVER.resolveOne("26_hi");
            assertEquals("Fe", s.symbol());
            assertEquals(ElementSpec.Kind.HIGH_ENERGY_SPLIT, s.kind());
        }

        @Test
        void compound_passesThroughUnchanged() {
            List<ElementSpec> out = RESOLVER.resolve(List.of("Fe", "Fe2O3"));
            assertEquals(List.of("Fe", "Fe2O3"), labels(out));
            assertTrue(out.get(1).isCompound());
        }

        @Test
        void unknownIdentifier_throws() {
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolve(List.of("Fe", "Xx")));
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolveOne(150));
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolveOne(26.5));
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolveOne(" "));
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolveOne(null));
        }

        @Test
        void formulaWithUnknownSymbols_isRejected() {
            // "FE" parses as F + E, and E is not an element
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolve(List.of("FE")));
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolve(List.of("Xx2")));
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolveOne("Fe2Xx3"));
        }

        @Test
        void splitCompound_isRejected() {
            assertThrows(InvalidElementException.class, () -> RESOLVER.resolveOne("Fe2O3_lo"));
        }

        @Test
        void toRowLabels_keepsSuffixesAndUnresolvable() {
            List<String> rows = RESOLVER.toRowLabels(List.of("26_lo", "Fe_hi", "8", "Fe2O3", "b0"));
            assertEquals(List.of("Fe_lo", "Fe_hi", "O", "Fe2O3", "b0"), rows);
        }

        @Test
        void resolve_isPure() {
            List<Object> raw = new ArrayList<>(List.of("Fe", 8));
            RESOLVER.resolve(raw);
            assertEquals(List.of("Fe", 8), raw);
        }
    }
}
