package uk.ac.ox.well.swalign;

import ch.qos.logback.classic.Level;
import org.testng.Assert;
import org.testng.annotations.Test;

public class MainTest {
    @Test
    public void testParseLevel() {
        Assert.assertEquals(Main.parseLevel("debug"), Level.DEBUG);
        Assert.assertEquals(Main.parseLevel("WARN"), Level.WARN);
        Assert.assertEquals(Main.parseLevel("off"), Level.OFF);
        Assert.assertEquals(Main.parseLevel(null), Level.INFO);
        Assert.assertEquals(Main.parseLevel("verbose"), Level.INFO);
    }

    @Test
    public void testLoggerIsConfigured() {
        Assert.assertNotNull(Main.getLogger());
        Assert.assertTrue(Main.getLogger().iteratorForAppenders().hasNext());
    }
}
