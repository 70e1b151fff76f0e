package net.langexplorer.generate;

import net.langexplorer.util.config.DynamicConfiguration;
import net.langexplorer.util.config.PropertiesConfiguration;
import net.langexplorer.util.features.HashingOrder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GenerationConfigTest {

    @Test
    void defaults() {
        GenerationConfig cfg = GenerationConfig.fromConfiguration(
            new DynamicConfiguration());
        assertEquals(1, cfg.getCount());
        assertEquals(0, cfg.getSeed());
        assertEquals(GenerationConfig.defaultWorkers(), cfg.getWorkers());
        assertEquals(0, cfg.getMaxAttempts());
        assertFalse(cfg.isReturnFeatures());
        assertFalse(cfg.isReturnPartials());
        assertEquals(3, cfg.getLabelExtraction().getIterations());
        assertEquals(HashingOrder.SELF_CHILDREN_PARENT,
                     cfg.getLabelExtraction().getOrder());
    }

    @Test
    void fromPropertiesResource() throws Exception {
        GenerationConfig cfg = GenerationConfig.fromConfiguration(
            PropertiesConfiguration.fromResource(
                getClass().getClassLoader(), "generation.properties"));
        assertEquals(25, cfg.getCount());
        assertEquals(1234, cfg.getSeed());
        assertEquals(2, cfg.getWorkers());
        assertEquals(500, cfg.getMaxAttempts());
        assertTrue(cfg.isReturnFeatures());
        assertTrue(cfg.isReturnEdgeLists());
        assertFalse(cfg.isReturnGraphviz());
        assertEquals(2, cfg.getLabelExtraction().getIterations());
        assertEquals(HashingOrder.PARENT_SELF_CHILDREN,
                     cfg.getLabelExtraction().getOrder());
        assertTrue(cfg.getLabelExtraction().isDedup());
    }

    @Test
    void explicitValuesWin() {
        DynamicConfiguration dc = new DynamicConfiguration();
        dc.addSource(new PropertiesConfiguration(new java.util.Properties()));
        dc.put(GenerationConfig.KEY_COUNT, "7");
        dc.put(GenerationConfig.KEY_RETURN_GRAMMAR, "yes");
        GenerationConfig cfg = GenerationConfig.fromConfiguration(dc);
        assertEquals(7, cfg.getCount());
        assertTrue(cfg.isReturnGrammar());
    }

    @Test
    void malformedValuesNameTheKey() {
        DynamicConfiguration dc = new DynamicConfiguration();
        dc.put(GenerationConfig.KEY_COUNT, "many");
        IllegalArgumentException exc = assertThrows(
            IllegalArgumentException.class,
            () -> GenerationConfig.fromConfiguration(dc));
        assertTrue(exc.getMessage().contains(GenerationConfig.KEY_COUNT));

        DynamicConfiguration dc2 = new DynamicConfiguration();
        dc2.put(GenerationConfig.KEY_WL_ORDER, "sideways");
        assertThrows(IllegalArgumentException.class,
            () -> GenerationConfig.fromConfiguration(dc2));

        DynamicConfiguration dc3 = new DynamicConfiguration();
        dc3.put(GenerationConfig.KEY_WORKERS, "0");
        assertThrows(IllegalArgumentException.class,
            () -> GenerationConfig.fromConfiguration(dc3));
    }

    @Test
    void systemPropertiesAreRead() {
        System.setProperty(GenerationConfig.KEY_WL_SORT, "true");
        try {
            assertTrue(GenerationConfig.fromEnvironment().getLabelExtraction()
                       .isSort());
        } finally {
            System.clearProperty(GenerationConfig.KEY_WL_SORT);
        }
    }

    @Test
    void jsonRendering() {
        GenerationConfig cfg = new GenerationConfig().setCount(9)
            .setSeed(-3).setWorkers(2).setReturnPartials(true);
        assertEquals(9, cfg.toJSON().getInt("count"));
        assertEquals(-3, cfg.toJSON().getLong("seed"));
        assertTrue(cfg.toJSON().getBoolean("return_partials"));
        assertEquals(3, cfg.toJSON().getJSONObject("label_extraction")
                        .getInt("iterations"));
    }

}
