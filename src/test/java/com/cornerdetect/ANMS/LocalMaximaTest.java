package com.cornerdetect.ANMS;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LocalMaximaTest {

    @Test
    public void testIsolatedPeak() {
        double[][] map = new double[9][11];
        map[4][6] = 10;

        List<CandidatePoint> maxima = LocalMaxima.getMaxima(map, 5);
        assertEquals(1, maxima.size());
        CandidatePoint p = maxima.get(0);
        assertEquals(6, p.getU());
        assertEquals(4, p.getV());
        assertEquals(10, p.getScore(), 0);
    }

    @Test
    public void testEqualNeighboursAreBothRejected() {
        double[][] map = new double[9][9];
        map[4][4] = 10;
        map[5][5] = 10;
        assertTrue(LocalMaxima.getMaxima(map, 5).isEmpty());

        map[5][5] = 9.999;
        assertEquals(1, LocalMaxima.getMaxima(map, 5).size());
    }

    @Test
    public void testBorderIsIgnored() {
        double[][] map = new double[6][6];
        map[0][3] = 50;
        map[3][5] = 50;
        map[5][0] = 50;
        assertTrue(LocalMaxima.getMaxima(map, 1).isEmpty());
    }

    @Test
    public void testThresholdIsInclusive() {
        double[][] map = new double[7][7];
        map[2][2] = 5;
        map[4][4] = 4.5;
        List<CandidatePoint> maxima = LocalMaxima.getMaxima(map, 5);
        assertEquals(1, maxima.size());
        assertEquals(new CandidatePoint(2, 2, 5), maxima.get(0));
    }

    @Test
    public void testScanOrderAndSortedOrder() {
        double[][] map = new double[10][10];
        map[2][7] = 3;
        map[5][2] = 8;
        map[7][6] = 5;

        List<CandidatePoint> scan = LocalMaxima.getMaxima(map, 1);
        assertEquals(3, scan.size());
        assertEquals(3, scan.get(0).getScore(), 0);
        assertEquals(8, scan.get(1).getScore(), 0);
        assertEquals(5, scan.get(2).getScore(), 0);

        List<CandidatePoint> sorted = LocalMaxima.getMaxima(map, 1, true);
        assertEquals(8, sorted.get(0).getScore(), 0);
        assertEquals(5, sorted.get(1).getScore(), 0);
        assertEquals(3, sorted.get(2).getScore(), 0);
    }

    @Test
    public void testNegativeResponses() {
        double[][] map = new double[5][5];
        for (double[] row : map) Arrays.fill(row, -10);
        map[2][2] = -1;
        assertEquals(1, LocalMaxima.getMaxima(map, -5).size());
        assertTrue(LocalMaxima.getMaxima(map, 0).isEmpty());
    }
}
