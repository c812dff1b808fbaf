package relief.siting.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CellLoaderTest {

    @TempDir
    Path dir;

    private Path write(String content) throws IOException {
        Path csv = dir.resolve("cells.csv");
        Files.writeString(csv, content, StandardCharsets.UTF_8);
        return csv;
    }

    @Test
    void loadsRowsAndDerivesMissingNeed() throws IOException {
        Path csv = write("id,lat,lon,population,risk_score,need,poverty_rate,snap_rate,vehicle_access_rate\n"
                + "a,40.0,-75.0,1000,2.5,300,0.2,0.1,0.9\n"
                + "\n"
                + "b,40.1,-75.1,500,3.0,,0.3,0.2,0.8\n"
                + "zero,40.2,-75.2,0,3.0,10,0.1,0.1,0.9\n");

        List<Cell> cells = CellLoader.load(csv);

        assertEquals(2, cells.size());
        Cell a = cells.get(0);
        assertEquals("a", a.id);
        assertEquals(300.0, a.needIndex, 1e-9);
        assertEquals(0.9, a.vehicleAccessRate, 1e-9);
        assertEquals(1500.0, cells.get(1).needIndex, 1e-9);
        assertTrue(a.isWellFormed());
    }

    @Test
    void acceptsAliasesAndDefaultsOptionalColumns() throws IOException {
        Path csv = write("GEOID,Latitude,Longitude,pop,food_insecurity_score,poverty_rate\n"
                + "\"42101000100\",39.95,-75.16,2400,4.2,0.35\n");

        List<Cell> cells = CellLoader.load(csv);

        assertEquals(1, cells.size());
        Cell c = cells.get(0);
        assertEquals("42101000100", c.id);
        assertEquals(39.95, c.lat, 1e-9);
        assertEquals(2400 * 4.2, c.needIndex, 1e-9);
        assertEquals(1.0, c.vehicleAccessRate, 1e-9);
        assertEquals(0.0, c.snapRate, 1e-9);
    }

    @Test
    void skipsRowsThatDoNotParse() throws IOException {
        Path csv = write("id,lat,lon,population,risk_score,poverty_rate\n"
                + "x,north,-75.0,100,1.0,0.1\n"
                + "y,40.0,-75.0,100,1.0,1.7\n"
                + "z,40.0,-75.0,100,1.0,0.1\n");

        List<Cell> cells = CellLoader.load(csv);

        assertEquals(1, cells.size());
        assertEquals("z", cells.get(0).id);
    }

    @Test
    void missingRequiredColumnIsAnError() throws IOException {
        Path csv = write("id,lon,population,risk_score\n" + "x,-75.0,100,1.0\n");

        IOException e = assertThrows(IOException.class, () -> CellLoader.load(csv));
        assertEquals("Missing column: lat (or latitude)", e.getMessage());
    }

    @Test
    void emptyFileIsAnError() throws IOException {
        Path csv = write("");
        assertThrows(IOException.class, () -> CellLoader.load(csv));
    }
}
