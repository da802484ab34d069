package uk.ac.ox.well.swalign.utils.packageutils;

import org.testng.Assert;
import org.testng.annotations.Test;
import uk.ac.ox.well.swalign.commands.Module;
import uk.ac.ox.well.swalign.commands.align.Align;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;

public class DispatchTest {
    @Test
    public void testAlignModuleIsDiscovered() {
        Map<String, Class<? extends Module>> modules = new PackageInspector<>(Module.class, "uk.ac.ox.well.swalign").getExtendingClassesMap();

        Assert.assertEquals(modules.get("Align"), Align.class);
        Assert.assertFalse(modules.containsKey("Module"));
    }

    @Test
    public void testDispatchRunsModule() throws IOException {
        File pair = File.createTempFile("pair", ".fa");
        pair.deleteOnExit();

        PrintStream ps = new PrintStream(pair);
        ps.print(">query\nACGTACGT\n>target\nACGTTACGT\n");
        ps.close();

        File out = File.createTempFile("swalign-dispatch", ".txt");
        out.deleteOnExit();

        Dispatch.main(Align.class, new String[] { "-i", pair.getAbsolutePath(), "-s", "EDNAFULL", "-o", "-10", "-e", "-1", "-c", "--out", out.getAbsolutePath() });

        String report = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);

        Assert.assertTrue(report.contains("|Best Local Alignment|"));
        Assert.assertTrue(report.contains("CIGAR:"));
    }
}
