package org.eds.app.service;

import org.apache.commons.math3.linear.MatrixUtils;
import org.eds.constraint.ConstraintMatrix;
import org.eds.constraint.RectangularRegion;
import org.eds.constraint.SpatialConstraint;
import org.eds.dictionary.PhysicsDictionary;
import org.eds.dictionary.ProblemType;
import org.eds.element.ElementSpec;
import org.eds.element.PeriodicTable;
import org.eds.engine.DecompositionRequest;
import org.eds.engine.FittedDecomposition;
import org.eds.error.InvalidElementException;
import org.eds.error.MissingMetadataException;
import org.eds.error.NoGroundTruthException;
import org.eds.metadata.DatasetMetadata;
import org.eds.model.EnergyAxis;
import org.eds.model.SpatialAxis;
import org.eds.model.SpectrumImage;
import org.eds.physics.TakeOffAngle;
import org.eds.quant.ModelContributions;
import org.eds.quant.QuantificationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpectrumAnalysisServiceTest {

    private static final EnergyAxis AXIS = new EnergyAxis(0.2, 0.02, 400);

    private SpectrumAnalysisService service;

    /**
     * Stands in for a solver: free W cells are 1, pinned cells keep their value, H is all ones
     * over the pixels the request leaves in.
     */
    private static FittedDecomposition fakeFit(DecompositionRequest req) {
        int rows = req.dictionary().columnCount();
        int k = req.components();
        double[][] w = new double[rows][k];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < k; c++) {
                int row = r;
                int col = c;
                w[r][c] = req.fixedWConstraint()
                        .map(m -> m.isFree(row, col) ? 1.0 : m.get(row, col).value())
                        .orElse(1.0);
            }
        }
        boolean[] mask = req.navigationMask();
        int pixels = req.data().getColumnDimension();
        if (mask != null) {
            for (boolean excluded : mask) {
                if (excluded) pixels--;
            }
        }
        double[][] h = new double[k][pixels];
        for (double[] row : h) Arrays.fill(row, 1.0);
        return new FittedDecomposition(MatrixUtils.createRealMatrix(w), MatrixUtils.createRealMatrix(h),
                req.dictionary().matrix().orElseThrow());
    }

    private static SpectrumImage image() {
        return new SpectrumImage(new double[2][2][AXIS.size()],
                SpatialAxis.unit("y", 2), SpatialAxis.unit("x", 2), DatasetMetadata.of(AXIS));
    }

    private void configure() {
        service.open(image());
        service.setMicroscopeParameters();
        service.setAnalysisParameters();
        service.addElements(List.of("Fe", 8));
    }

    @BeforeEach
    void setUp() {
        service = new SpectrumAnalysisService(SpectrumAnalysisServiceTest::fakeFit);
    }

    @Test
    void fullWorkflow_pinnedIronGivesPureOxygen() {
        configure();
        PhysicsDictionary d = service.buildDictionary(ProblemType.CHARACTERISTIC_PLUS_BACKGROUND);
        assertEquals(List.of("Fe", "O", "b0", "b1"), d.columnLabels());

        ConstraintMatrix w = service.fixedW(Map.of("p0", Map.of("Fe", 0.0)));
        FittedDecomposition fit = service.decompose(1, w, null, null);
        assertSame(fit, service.lastFit().orElseThrow());

        QuantificationResult q = service.quantify(false, List.of());
        for (double v : q.values("O")) assertEquals(100.0, v, 1e-9);
        for (double v : q.values("Fe")) assertEquals(0.0, v, 1e-9);

        assertTrue(service.concentrationReport(true, null).startsWith("Abs. quantif. report\n"));
        assertTrue(service.concentrationReport(false, List.of("O")).contains("O : 1.0000"));

        ModelContributions mc = service.modelContributions();
        assertEquals(List.of("Fe", "O", ModelContributions.BACKGROUND_1, ModelContributions.BACKGROUND_2), mc.labels());
    }

    @Test
    void addElements_resolvesAndStoresLabels() {
        service.open(image());
        List<ElementSpec> specs = service.addElements(List.of(26, "O", "Fe2O3"));
        assertEquals(3, specs.size());
        assertEquals(List.of("Fe", "O", "Fe2O3"), service.image().metadata().sample().elements());

        service.addElements(List.of("Si"));
        assertEquals(List.of("Si"), service.image().metadata().sample().elements());
    }

    @Test
    void analysisParameters_needMicroscopeFirst() {
        service.open(image());
        assertThrows(MissingMetadataException.class, () -> service.setAnalysisParameters());
        service.setMicroscopeParameters();
        assertThrows(IllegalArgumentException.class,
                () -> service.setAnalysisParameters(-1, 3.5, "SDD_efficiency.txt", 0.01, 0.065, null));
    }

    @Test
    void microscopeChange_updatesTakeOffAngle() {
        configure();
        service.setMicroscopeParameters(200, 45, 30, 10);
        double expected = TakeOffAngle.of(10, 45, 30);
        assertEquals(expected, service.image().metadata().detector().takeOffAngle(), 1e-12);
        assertEquals(200.0, service.image().metadata().microscope().beamEnergy(), 0.0);
    }

    @Test
    void operationsOutOfOrder_throw() {
        assertThrows(IllegalStateException.class, () -> service.image());
        service.open(image());
        assertThrows(IllegalStateException.class, () -> service.fixedW(Map.of()));
        assertThrows(IllegalStateException.class, () -> service.quantify(false, List.of()));
        assertThrows(IllegalStateException.class, () -> service.refreshDictionary(MatrixUtils.createRealMatrix(1, 1)));
        assertThrows(NoGroundTruthException.class, () -> service.groundTruth(true));
    }

    @Test
    void refresh_onlyForBackgroundDictionary() {
        configure();
        service.buildDictionary(ProblemType.CHARACTERISTIC_ONLY);
        assertThrows(IllegalStateException.class,
                () -> service.refreshDictionary(MatrixUtils.createRealMatrix(new double[][]{{1}, {1}})));

        PhysicsDictionary bg = service.buildDictionary(ProblemType.CHARACTERISTIC_PLUS_BACKGROUND);
        FittedDecomposition fit = service.decompose(2, null, null, null);
        assertSame(bg, service.refreshDictionary(fit.w()));
    }

    @Test
    void maskedDecomposition_givesNaNAtExcludedPixels() {
        configure();
        service.buildDictionary(ProblemType.CHARACTERISTIC_ONLY);
        boolean[] mask = {false, true, false, false};
        FittedDecomposition fit = service.decompose(1, null, null, mask);
        assertEquals(3, fit.h().getColumnDimension());

        QuantificationResult masked = service.quantify(true, List.of());
        assertTrue(Double.isNaN(masked.values("Fe")[1]));
        assertFalse(Double.isNaN(masked.values("Fe")[0]));

        ModelContributions mc = service.modelContributions();
        assertTrue(Double.isNaN(mc.pixelContributions(1).total().get(0)));
    }

    @Test
    void constraintsThroughService() {
        configure();
        service.buildDictionary(ProblemType.CHARACTERISTIC_PLUS_BACKGROUND);

        ConstraintMatrix chem = service.chemicalMappingW(1);
        assertEquals(4, chem.rowCount());
        assertEquals(3, chem.columnCount());

        ConstraintMatrix h = service.fixedH(Map.of("p0",
                SpatialConstraint.regions(List.of(new RectangularRegion(0, 0, 1, 1)), 1.0)));
        assertEquals(1, h.pinnedCount());
        assertEquals(1.0, h.get(0, 0).value(), 0.0);
    }

    @Test
    void strictService_rejectsUnknownIdentifiers() {
        SpectrumAnalysisService strict = new SpectrumAnalysisService(
                SpectrumAnalysisServiceTest::fakeFit, PeriodicTable.standard(), true);
        strict.open(image());
        strict.setMicroscopeParameters();
        strict.setAnalysisParameters();
        strict.addElements(List.of("Fe", "O"));
        strict.buildDictionary(ProblemType.CHARACTERISTIC_ONLY);
        assertThrows(InvalidElementException.class, () -> strict.fixedW(Map.of("p0", Map.of("Cu", 0.0))));
    }

    @Test
    void metadataSaveLoad_allowsRebuild(@TempDir Path dir) {
        configure();
        PhysicsDictionary built = service.buildDictionary(ProblemType.CHARACTERISTIC_ONLY,
                Map.of("Fe", 2.0), List.of());
        Path file = dir.resolve("md.json");
        service.saveMetadata(file);

        service.open(image());
        service.loadMetadata(file);
        assertTrue(service.dictionary().isEmpty());
        PhysicsDictionary rebuilt = service.rebuildDictionary();
        assertEquals(built.columnLabels(), rebuilt.columnLabels());
        assertArrayEquals(built.norms(), rebuilt.norms(), 1e-12);
    }

    @Test
    void recalibrate_anchorsHighPeak() {
        service.open(image());
        int highChannel = AXIS.indexOf(6.5);
        service.recalibrate(0.5, 6.5, 0.525, 6.404);
        EnergyAxis now = service.image().metadata().energyAxis();
        assertEquals(6.404, now.energyAt(highChannel), 1e-9);
        assertEquals(0.02 * (6.404 - 0.525) / 6.0, now.scale(), 1e-12);
    }
}
