import com.fasterxml.jackson.core.type.TypeReference;
import org.eds.io.json.JsonTableSource;
import org.eds.io.json.MetadataStore;
import org.eds.metadata.DatasetMetadata;
import org.eds.metadata.Detector;
import org.eds.metadata.DetectorLayer;
import org.eds.metadata.GroundTruthData;
import org.eds.metadata.Microscope;
import org.eds.metadata.ModelState;
import org.eds.metadata.Sample;
import org.eds.model.EnergyAxis;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Covers:
 * - MetadataStore (JSON save/load of dataset metadata)
 * - JsonTableSource (parsing, caching, failures)
 */
public class MetadataIoTest {

    // ----------------------------
    // Helpers
    // ----------------------------

    private static DatasetMetadata full() {
        Detector detector = new Detector(null,
                List.of(new DetectorLayer("Si", 1e-5, 2.33)),
                new DetectorLayer("Si", 0.045, 2.33),
                0.01, 0.065, 22.0);
        ModelState model = new ModelState("bremsstrahlung", Map.of("Fe", 3.0), List.of("Fe2O3"),
                List.of("Fe_lo", "Fe_hi", "Fe2O3"), new double[]{0.5, 0.25, 2.0});
        GroundTruthData truth = new GroundTruthData(
                new double[][]{{1, 2, 3}},
                new double[][][]{{{0.5}, {1.0}}});
        return new DatasetMetadata(Microscope.defaults(), detector,
                new Sample(1e-5, 5.2, List.of("Fe", "O")),
                new EnergyAxis(0.2, 0.01, 3), "default_xrays.json", model, truth);
    }

    private static JsonTableSource<List<Map<String, Object>>> source(String json, AtomicInteger opens) {
        return new JsonTableSource<>("inline", () -> {
            opens.incrementAndGet();
            return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
        }, new TypeReference<List<Map<String, Object>>>() {
        });
    }

    // ----------------------------
    // MetadataStore
    // ----------------------------

    @Nested
    class StoreTests {

        private final MetadataStore store = new MetadataStore();

        @Test
        void saveLoad_restoresEverySection(@TempDir Path dir) {
            Path file = dir.resolve("dataset.json");
            DatasetMetadata original = full();
            store.save(original, file);
            assertTrue(Files.exists(file));

            DatasetMetadata back = store.load(file);
            assertEquals(original.microscope(), back.microscope());
            assertEquals(original.detector(), back.detector());
            assertTrue(back.detector().isParametric());
            assertEquals(original.sample(), back.sample());
            assertEquals(original.energyAxis(), back.energyAxis());
            assertEquals(original.xrayDb(), back.xrayDb());

            assertEquals("bremsstrahlung", back.model().problemType());
            assertEquals(Map.of("Fe", 3.0), back.model().referenceElements());
            assertEquals(List.of("Fe_lo", "Fe_hi", "Fe2O3"), back.model().elements());
            assertArrayEquals(new double[]{0.5, 0.25, 2.0}, back.model().norm(), 0.0);

            assertArrayEquals(new double[]{1, 2, 3}, back.truth().phases()[0], 0.0);
            assertEquals(1.0, back.truth().maps()[0][1][0], 0.0);
        }

        @Test
        void absentSections_stayAbsent(@TempDir Path dir) {
            Path file = dir.resolve("bare.json");
            store.save(DatasetMetadata.of(new EnergyAxis(0.1, 0.02, 10)), file);

            DatasetMetadata back = store.load(file);
            assertNull(back.microscope());
            assertNull(back.detector());
            assertNull(back.model());
            assertNull(back.truth());
            assertEquals(new EnergyAxis(0.1, 0.02, 10), back.energyAxis());
        }

        @Test
        void toJson_omitsNulls() {
            String json = store.toJson(DatasetMetadata.of(new EnergyAxis(0.1, 0.02, 10)));
            assertFalse(json.contains("truth"));
            assertTrue(json.contains("energyAxis"));
        }

        @Test
        void missingFile_throwsUnchecked(@TempDir Path dir) {
            assertThrows(UncheckedIOException.class, () -> store.load(dir.resolve("nope.json")));
        }

        @Test
        void nullDocument_isRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> store.read(new ByteArrayInputStream("null".getBytes(StandardCharsets.UTF_8))));
        }
    }

    // ----------------------------
    // JsonTableSource
    // ----------------------------

    @Nested
    class TableSourceTests {

        @Test
        void load_parsesOnceAndCaches() {
            AtomicInteger opens = new AtomicInteger();
            JsonTableSource<List<Map<String, Object>>> src = source("[{\"symbol\":\"Fe\",\"z\":26}]", opens);

            List<Map<String, Object>> first = src.load();
            List<Map<String, Object>> second = src.load();
            assertSame(first, second);
            assertEquals(1, opens.get());
            assertEquals("Fe", first.get(0).get("symbol"));
            assertEquals("inline", src.name());
        }

        @Test
        void badJson_throwsUnchecked() {
            JsonTableSource<List<Map<String, Object>>> src = source("[{", new AtomicInteger());
            assertThrows(UncheckedIOException.class, src::load);
        }

        @Test
        void nullJson_isRejected() {
            JsonTableSource<List<Map<String, Object>>> src = source("null", new AtomicInteger());
            assertThrows(IllegalArgumentException.class, src::load);
        }

        @Test
        void missingClasspathResource_throwsUnchecked() {
            JsonTableSource<List<Map<String, Object>>> src =
                    JsonTableSource.classpath("no_such_table.json", new TypeReference<List<Map<String, Object>>>() {
                    });
            assertThrows(UncheckedIOException.class, src::load);
        }

        @Test
        void blankName_throws() {
            assertThrows(IllegalArgumentException.class, () -> new JsonTableSource<>(" ",
                    () -> {
                        throw new IOException("unused");
                    }, new TypeReference<List<Object>>() {
                    }));
        }

        @Test
        void bundledTables_load() {
            JsonTableSource<List<Map<String, Object>>> src =
                    JsonTableSource.classpath("periodic_table.json", new TypeReference<List<Map<String, Object>>>() {
                    });
            assertFalse(src.load().isEmpty());
        }
    }
}
