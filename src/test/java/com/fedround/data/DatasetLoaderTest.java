package com.fedround.data;

import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DatasetLoaderTest {

    private static Dataset parse(String csv) throws IOException {
        return DatasetLoader.parse(new BufferedReader(new StringReader(csv)), DatasetLoader.DEFAULT_LABEL_COLUMN);
    }

    @Test
    public void testParsesFeaturesAndLabel() throws Exception {
        Dataset data = parse(
            "N,P,label,ph\n" +
            "90,42,rice,6.5\n" +
            "\n" +
            "20, 67 , maize ,5.9\n");

        assertEquals(2, data.size());
        assertEquals(List.of("N", "P", "ph"), data.featureNames());
        assertEquals(List.of("maize", "rice"), data.labels());

        Row second = data.row(1);
        assertEquals(1, second.getIndex());
        assertEquals("maize", second.getLabel());
        assertArrayEquals(new double[]{20, 67, 5.9}, second.getFeatures());
    }

    @Test
    public void testMissingLabelColumn() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> parse("a,b\n1,2\n"));
        assertTrue(e.getMessage().contains("label"));
    }

    @Test
    public void testMalformedRowNamesLine() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> parse("a,label\n1,x\n2\n"));
        assertTrue(e.getMessage().contains("Line 3"), e.getMessage());
    }

    @Test
    public void testNonNumericFeature() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> parse("a,label\nabc,x\n"));
        assertTrue(e.getMessage().contains("Line 2"), e.getMessage());
    }

    @Test
    public void testCustomLabelColumn() throws Exception {
        Dataset data = DatasetLoader.parse(new BufferedReader(new StringReader("crop,x\nrice,1\n")), "crop");
        assertEquals(List.of("x"), data.featureNames());
        assertEquals(List.of("rice"), data.labels());
    }

    @Test
    public void testEmptyInput() {
        assertThrows(IllegalArgumentException.class, () -> parse(""));
    }

    @Test
    public void testLoadsSampleFile() throws Exception {
        Path path = Paths.get(getClass().getResource("/crops-sample.csv").toURI());

        Dataset data = DatasetLoader.fromCsv(path);

        assertEquals(90, data.size());
        assertEquals(7, data.featureCount());
        assertEquals(List.of("chickpea", "maize", "rice"), data.labels());
        assertEquals(89, data.row(89).getIndex());
    }
}
