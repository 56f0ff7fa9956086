package com.cornerdetect.API;

import com.cornerdetect.ANMS.AnmsVariant;
import com.cornerdetect.ANMS.UnresolvedPolicy;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {"corner.anms.variant=KD_TREE", "corner.anms.edge=3"})
public class CornerDetectionPropertiesTest {

    @Autowired
    private CornerDetectionProperties properties;

    @Autowired
    private CornerDetectionService service;

    @Test
    public void testLoadConfigFromPropertiesFile() {
        assertEquals("valid", properties.getBoundaryMode());
        assertEquals(0, properties.getFillValue(), 0);
        assertEquals(100, properties.getAnms().getN());
        assertEquals(0.9, properties.getAnms().getC(), 1e-12);
        assertTrue(properties.getAnms().isUseThreshold());
        assertEquals(UnresolvedPolicy.OMIT, properties.getAnms().getUnresolvedPolicy());
        assertNotNull(service);
    }

    @Test
    public void testOverridesAreBound() {
        assertEquals(AnmsVariant.KD_TREE, properties.getAnms().getVariant());
        assertEquals(3, properties.getAnms().getEdge());
    }
}
