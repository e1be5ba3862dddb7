package com.nightscan.data;

import com.nightscan.model.StockCandidate;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class UniverseLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_shouldSkipCommentsAndKeepFirstDuplicate() throws Exception {
        Path file = tempDir.resolve("universe.csv");
        Files.writeString(file, String.join("\n",
                "symbol,name,sector",
                "# comment",
                "aapl.us,Apple Inc.,Technology",
                "",
                "AAPL.US,Apple duplicate,Other",
                "xom.us,,"
        ), StandardCharsets.UTF_8);

        List<StockCandidate> universe = new UniverseLoader().load(file);

        assertEquals(2, universe.size());
        assertEquals("Apple Inc.", universe.get(0).name);
        assertEquals("xom.us", universe.get(1).name);
        assertEquals("Unknown", universe.get(1).sector);
    }

    @Test
    void load_shouldFailWhenFileMissing() {
        assertThrows(IOException.class, () -> new UniverseLoader().load(tempDir.resolve("missing.csv")));
    }

    @Test
    void parse_shouldAcceptHeaderlessInput() {
        List<StockCandidate> universe = UniverseLoader.parse(List.of("msft.us,Microsoft,Technology"));

        assertEquals(1, universe.size());
        assertEquals("msft.us", universe.get(0).symbol);
    }
}
