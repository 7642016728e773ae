import org.eds.element.ChemicalFormula;
import org.eds.element.PeriodicTable;
import org.eds.error.CalibrationException;
import org.eds.error.InvalidElementException;
import org.eds.error.MissingMetadataException;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.Detector;
import org.eds.metadata.DetectorLayer;
import org.eds.metadata.Microscope;
import org.eds.metadata.Sample;
import org.eds.model.EnergyAxis;
import org.eds.model.Spectrum;
import org.eds.physics.AbsorptionModel;
import org.eds.physics.Composition;
import org.eds.physics.EmissionModel;
import org.eds.physics.LayeredEfficiency;
import org.eds.physics.LineShape;
import org.eds.physics.MassAttenuation;
import org.eds.physics.PhysicsModel;
import org.eds.physics.PhysicsParameters;
import org.eds.physics.TabulatedEfficiency;
import org.eds.physics.TakeOffAngle;
import org.eds.physics.XrayLineDatabase;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the physics model:
 * - line shape, emission, take-off angle
 * - detector efficiency (tabulated + layered)
 * - attenuation / absorption
 * - parameter validation from metadata
 * - synthesized characteristic and bremsstrahlung spectra
 */
public class PhysicsTest {

    // ----------------------------
    // Helpers
    // ----------------------------

    private static final PeriodicTable TABLE = PeriodicTable.standard();
    private static final EnergyAxis AXIS = new EnergyAxis(0.2, 0.01, 2000);

    private static DatasetMetadata metadata(EnergyAxis axis) {
        return new DatasetMetadata(
                Microscope.defaults(),
                new Detector(Detector.DEFAULT_TYPE, null, null,
                        Detector.DEFAULT_WIDTH_SLOPE, Detector.DEFAULT_WIDTH_INTERCEPT, 22.0),
                new Sample(Sample.DEFAULT_THICKNESS, Sample.DEFAULT_DENSITY, List.of("Fe", "O")),
                axis, DatasetMetadata.DEFAULT_XRAY_DB, null, null);
    }

    private static PhysicsModel model(double beamEnergy) {
        DatasetMetadata md = metadata(AXIS).withMicroscope(
                new Microscope(beamEnergy, 0, 0, Microscope.DEFAULT_ELEVATION, Microscope.DEFAULT_RESOLUTION_MNKA));
        return new PhysicsModel(PhysicsParameters.from(md), TABLE);
    }

    private static MassAttenuation attenuation() {
        return new MassAttenuation(TABLE, XrayLineDatabase.named(DatasetMetadata.DEFAULT_XRAY_DB));
    }

    // ----------------------------
    // Line shape + emission + geometry
    // ----------------------------

    @Nested
    class LineTests {

        @Test
        void profile_hasUnitArea_andPeaksAtCenter() {
            LineShape shape = new LineShape(0.01, 0.065);
            double[] p = shape.profile(AXIS, 6.404);
            double sum = 0;
            int argmax = 0;
            for (int i = 0; i < p.length; i++) {
                sum += p[i];
                if (p[i] > p[argmax]) argmax = i;
            }
            assertEquals(1.0, sum, 1e-6);
            assertEquals(AXIS.indexOf(6.404), argmax);
        }

        @Test
        void sigma_isLinearInEnergy() {
            LineShape shape = new LineShape(0.01, 0.065);
            assertEquals(0.065, shape.sigma(0), 1e-12);
            assertEquals(0.165, shape.sigma(10), 1e-12);
            assertThrows(IllegalArgumentException.class, () -> new LineShape(0.01, 0.0));
        }

        @Test
        void crossSection_zeroBelowEdge() {
            assertEquals(0.0, EmissionModel.crossSection(5.0, 7.112));
            assertEquals(0.0, EmissionModel.crossSection(7.112, 7.112));
            assertTrue(EmissionModel.crossSection(200, 7.112) > 0);
        }

        @Test
        void fluorescenceYield_growsWithZ() {
            double fe = EmissionModel.fluorescenceYield(26, "K");
            assertEquals(456976.0 / (1.0e6 + 456976.0), fe, 1e-12);
            assertTrue(EmissionModel.fluorescenceYield(8, "K") < fe);
            assertThrows(IllegalArgumentException.class, () -> EmissionModel.fluorescenceYield(26, "N"));
        }

        @Test
        void takeOffAngle_untiltedEqualsElevation() {
            assertEquals(22.0, TakeOffAngle.of(0, 0, 22), 1e-9);
            assertEquals(32.0, TakeOffAngle.of(10, 0, 22), 1e-9);
        }
    }

    // ----------------------------
    // Detector efficiency
    // ----------------------------

    @Nested
    class EfficiencyTests {

        @Test
        void tabulated_interpolatesAndClamps() {
            TabulatedEfficiency t = new TabulatedEfficiency(new double[]{1, 11}, new double[]{0, 1});
            assertEquals(0.5, t.at(6), 1e-12);
            assertEquals(0.0, t.at(0.1), 1e-12);
            assertEquals(1.0, t.at(50), 1e-12);
        }

        @Test
        void named_isLoadedOnce_andRealistic() {
            TabulatedEfficiency a = TabulatedEfficiency.named(Detector.DEFAULT_TYPE);
            assertSame(a, TabulatedEfficiency.named(Detector.DEFAULT_TYPE));
            assertTrue(a.at(1.0) > 0.9);
            assertTrue(a.at(20.0) < a.at(5.0));
        }

        @Test
        void named_missingResource_throws() {
            assertThrows(IllegalArgumentException.class, () -> TabulatedEfficiency.named("no_such_detector.txt"));
        }

        @Test
        void layered_isBetweenZeroAndOne() {
            LayeredEfficiency eff = new LayeredEfficiency(
                    List.of(new DetectorLayer("C", 1e-5, 2.0)),
                    new DetectorLayer("Si", 0.045, 2.33),
                    attenuation());
            double at5 = eff.at(5.0);
            assertTrue(at5 > 0.0 && at5 <= 1.0);
            Spectrum over = eff.over(new EnergyAxis(1.0, 1.0, 3));
            assertEquals(3, over.channels());
        }
    }

    // ----------------------------
    // Attenuation + absorption + composition
    // ----------------------------

    @Nested
    class AbsorptionTests {

        @Test
        void attenuation_jumpsUpAcrossEdge() {
            MassAttenuation mu = attenuation();
            assertTrue(mu.of("Fe", 7.2) > mu.of("Fe", 7.0));
            assertTrue(mu.of("Fe", 2.0) > mu.of("Fe", 4.0));
            assertThrows(IllegalArgumentException.class, () -> mu.of("Fe", 0.0));
        }

        @Test
        void composition_convertsAtomsToMass() {
            Composition c = Composition.fromAtomic(Map.of("Fe", 2.0, "O", 3.0), TABLE);
            double fe = 2 * 55.845;
            double o = 3 * TABLE.requireSymbol("O").weight();
            assertEquals(fe / (fe + o), c.massFractions().get("Fe"), 1e-12);
            assertThrows(IllegalArgumentException.class, () -> Composition.fromAtomic(Map.of("Fe", 0.0), TABLE));
        }

        @Test
        void absorptionFactor_inUnitInterval() {
            Composition c = Composition.equiatomic(List.of("Fe", "O"), TABLE);
            AbsorptionModel thin = new AbsorptionModel(attenuation(), 0.0, 3.5, 22);
            AbsorptionModel thick = new AbsorptionModel(attenuation(), 200e-7, 3.5, 22);
            assertEquals(1.0, thin.factor(c, 1.0), 0.0);
            double f = thick.factor(c, 1.0);
            assertTrue(f > 0.0 && f < 1.0);
            // soft x-rays are absorbed more
            assertTrue(thick.factor(c, 0.6) < thick.factor(c, 5.0));
        }

        @Test
        void absorption_rejectsBadAngle() {
            assertThrows(IllegalArgumentException.class, () -> new AbsorptionModel(attenuation(), 1e-5, 3, 0));
            assertThrows(IllegalArgumentException.class, () -> new AbsorptionModel(attenuation(), 1e-5, 3, 95));
        }
    }

    // ----------------------------
    // PhysicsParameters
    // ----------------------------

    @Nested
    class ParameterTests {

        @Test
        void from_completeMetadata() {
            PhysicsParameters p = PhysicsParameters.from(metadata(AXIS));
            assertEquals(200.0, p.beamEnergy());
            assertEquals(22.0, p.takeOffAngle());
            assertEquals(DatasetMetadata.DEFAULT_XRAY_DB, p.xrayDb());
        }

        @Test
        void axisIncludingZero_throwsCalibration() {
            assertThrows(CalibrationException.class,
                    () -> PhysicsParameters.from(metadata(new EnergyAxis(0.0, 0.01, 100))));
            assertThrows(CalibrationException.class,
                    () -> PhysicsParameters.from(metadata(new EnergyAxis(0.01, 0.01, 100))));
            assertThrows(CalibrationException.class,
                    () -> PhysicsParameters.from(metadata(new EnergyAxis(Double.NaN, 0.01, 100))));
            assertDoesNotThrow(() -> PhysicsParameters.from(metadata(new EnergyAxis(0.011, 0.01, 100))));
        }

        @Test
        void missingPieces_throwMissingMetadata() {
            DatasetMetadata md = metadata(AXIS);
            assertThrows(MissingMetadataException.class, () -> PhysicsParameters.from(md.withMicroscope(null)));
            assertThrows(MissingMetadataException.class, () -> PhysicsParameters.from(md.withDetector(null)));
            assertThrows(MissingMetadataException.class,
                    () -> PhysicsParameters.from(md.withSample(new Sample(null, 3.5, List.of()))));
            assertThrows(MissingMetadataException.class, () -> PhysicsParameters.from(md.withEnergyAxis(null)));
            assertThrows(MissingMetadataException.class, () -> PhysicsParameters.from(
                    md.withDetector(new Detector("SDD_efficiency.txt", null, null, 0.01, 0.065, null))));
        }

        @Test
        void missingXrayDb_fallsBackToDefault() {
            PhysicsParameters p = PhysicsParameters.from(metadata(AXIS).withXrayDb(null));
            assertEquals(DatasetMetadata.DEFAULT_XRAY_DB, p.xrayDb());
        }
    }

    // ----------------------------
    // PhysicsModel
    // ----------------------------

    @Nested
    class ModelTests {

        @Test
        void characteristic_peaksAtLineEnergies() {
            PhysicsModel m = model(200);
            Composition c = Composition.equiatomic(List.of("Fe"), TABLE);
            Spectrum fe = m.characteristic("Fe", c);
            int ka = AXIS.indexOf(6.404);
            assertTrue(fe.get(ka) > 0);
            assertTrue(fe.get(ka) > fe.get(AXIS.indexOf(5.5)) * 1000);
        }

        @Test
        void lineFilter_selectsEnergyRange() {
            PhysicsModel m = model(200);
            Composition c = Composition.equiatomic(List.of("Fe"), TABLE);
            Spectrum low = m.characteristic("Fe", c, e -> e < 3.0);
            Spectrum high = m.characteristic("Fe", c, e -> e >= 3.0);
            int ka = AXIS.indexOf(6.404);
            int la = AXIS.indexOf(0.705);
            assertTrue(low.get(la) > 0);
            assertTrue(low.get(ka) < 1e-12);
            assertTrue(high.get(ka) > 0);
            assertTrue(high.get(la) < 1e-12);
            Spectrum all = m.characteristic("Fe", c);
            assertEquals(all.sum(), low.sum() + high.sum(), all.sum() * 1e-9);
        }

        @Test
        void compound_isAtomFractionWeighted() {
            PhysicsModel m = model(200);
            Composition c = Composition.equiatomic(List.of("Fe", "O"), TABLE);
            Spectrum compound = m.compound(ChemicalFormula.parse("Fe2O3").orElseThrow(), c);
            Spectrum expected = m.characteristic("Fe", c).scale(0.4).add(m.characteristic("O", c).scale(0.6));
            assertArrayEquals(expected.toArrayCopy(), compound.toArrayCopy(), 1e-15);
        }

        @Test
        void bremsstrahlung_vanishesAtBeamEnergy() {
            PhysicsModel m = model(10);
            Spectrum[] b = m.bremsstrahlung(Composition.equiatomic(List.of("Si"), TABLE));
            assertEquals(2, b.length);
            int cut = AXIS.indexOf(10.0);
            assertEquals(0.0, b[0].get(cut + 1), 0.0);
            assertEquals(0.0, b[1].get(AXIS.size() - 1), 0.0);

            int i = AXIS.indexOf(4.0);
            double e = AXIS.energyAt(i);
            assertEquals(10.0 - e, b[1].get(i) / b[0].get(i), 1e-9);
        }

        @Test
        void unknownElementInDatabase_throws() {
            PhysicsModel m = model(200);
            Composition c = Composition.equiatomic(List.of("Fe"), TABLE);
            assertThrows(InvalidElementException.class, () -> m.characteristic("He", c));
        }
    }
}
