package uk.ac.ox.well.swalign;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import org.slf4j.LoggerFactory;
import uk.ac.ox.well.swalign.commands.Module;
import uk.ac.ox.well.swalign.utils.arguments.Description;
import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;
import uk.ac.ox.well.swalign.utils.packageutils.Dispatch;
import uk.ac.ox.well.swalign.utils.packageutils.PackageInspector;

import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.util.Arrays;
import java.util.Map;
import java.util.Properties;

/**
 * Main class for SWAlign.  Sets up the logger, handles help message, selects the module to run and passes through
 * command-line arguments.
 */
public class Main {
    private static Logger log = configureLogger();

    public static String progName = SWAlign.progName;
    public static String progDesc = SWAlign.progDesc;
    public static String rootPackage = SWAlign.rootPackage;

    /**
     * Main method for SWAlign.  First argument must be the module to run.  All other arguments are passed through
     * to the module for processing.
     *
     * @param args  Command-line arguments
     */
    public static void start(String newProgName, String newProgDesc, String newRootPackage, String[] args) {
        progName = newProgName;
        progDesc = newProgDesc;
        rootPackage = newRootPackage;

        if (args.length == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            showPrimaryHelp();
        } else {
            String moduleName = args[0];
            String[] moduleArgs = Arrays.copyOfRange(args, 1, args.length);

            Map<String, Class<? extends Module>> modules = new PackageInspector<>(Module.class, rootPackage).getExtendingClassesMap();

            if (!modules.containsKey(moduleName)) {
                showInvalidModuleMessage(moduleName);
            } else {
                Dispatch.main(modules.get(moduleName), moduleArgs);
            }
        }
    }

    /**
     * Get the process id for this instance
     *
     * @return the process id
     */
    private static String getProcessID() {
        String vmName = ManagementFactory.getRuntimeMXBean().getName();

        if (vmName.contains("@")) {
            return vmName.substring(0, vmName.indexOf('@'));
        }

        return vmName;
    }

    /**
     * Configure a logger that contains the log level, timestamp, module, method, and line number of the logging statement.
     *
     * @return  A fully-configured logger
     */
    private static Logger configureLogger() {
        Logger rootLogger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(SWAlign.class);

        String logLevel = System.getProperty("loglevel");
        LoggerContext loggerContext = rootLogger.getLoggerContext();
        loggerContext.reset();

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(loggerContext);

        if (logLevel != null && logLevel.equals("DEBUG")) {
            encoder.setPattern("%level [%date{dd/MM/yy HH:mm:ss} " + getProcessID() + " %class{0}:%L] %message%n");
        } else {
            encoder.setPattern("%.-1level [%date{yyyy-MM-dd HH:mm} " + getProcessID() + "] %message%n");
        }

        encoder.start();

        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(loggerContext);
        appender.setEncoder(encoder);
        appender.setTarget("System.err");
        appender.start();

        rootLogger.addAppender(appender);
        rootLogger.setLevel(parseLevel(logLevel));

        return rootLogger;
    }

    static Level parseLevel(String logLevel) {
        if (logLevel != null) {
            if      (logLevel.equalsIgnoreCase("OFF"))   { return Level.OFF;   }
            else if (logLevel.equalsIgnoreCase("TRACE")) { return Level.TRACE; }
            else if (logLevel.equalsIgnoreCase("DEBUG")) { return Level.DEBUG; }
            else if (logLevel.equalsIgnoreCase("INFO"))  { return Level.INFO;  }
            else if (logLevel.equalsIgnoreCase("WARN"))  { return Level.WARN;  }
            else if (logLevel.equalsIgnoreCase("ERROR")) { return Level.ERROR; }
            else if (logLevel.equalsIgnoreCase("ALL"))   { return Level.ALL;   }
        }

        return Level.INFO;
    }

    /**
     * Get the configured logger.
     *
     * @return  A fully-configured logger
     */
    public static Logger getLogger() {
        return log;
    }

    /**
     * Extract the build properties from the file automatically built at compile time.
     *
     * @return a populated Properties object, or null if the file is not on the classpath
     */
    public static Properties getBuildProperties() {
        InputStream propStream = SWAlign.class.getClassLoader().getResourceAsStream("build.properties");

        if (propStream != null) {
            try {
                Properties prop = new Properties();
                prop.load(propStream);

                return prop;
            } catch (IOException e) {
                throw new SWAlignException("Unable to read build.properties file from within package", e);
            }
        }

        return null;
    }

    /**
     * List all of the available modules.
     */
    private static void showPrimaryHelp() {
        Map<String, Class<? extends Module>> commands = new PackageInspector<>(Module.class, rootPackage).getExtendingClassesMap();

        int maxlength = 0;
        for (String t : commands.keySet()) {
            maxlength = (t.length() > maxlength) ? t.length() : maxlength;
        }

        Properties prop = getBuildProperties();

        System.out.println();
        System.out.println("Program: " + progName + " (" + progDesc + ")");
        System.out.println();
        if (prop != null) {
            System.out.format("Version: %s%n", prop.getProperty("version"));
            System.out.println("Times:   (build) " + prop.getProperty("build.date"));
            System.out.println();
        }

        System.out.println("Usage:   java -jar " + progName.toLowerCase() + ".jar <command> [options]");
        System.out.println();

        System.out.print("Command:");
        int padwidth = 1;
        for (String t : commands.keySet()) {
            Description d = commands.get(t).getAnnotation(Description.class);
            String description = (d == null) ? "no description available" : d.text();

            System.out.format("%" + padwidth + "s%-" + maxlength + "s     %s%n", "", t, description);

            padwidth = 9;
        }

        System.out.println();
    }

    /**
     * Show error message when a requested module is not available.
     *
     * @param module  The name of the requested module
     */
    private static void showInvalidModuleMessage(String module) {
        System.out.println(progName.toLowerCase() + ": '" + module + "' is not a valid module. See 'java -jar " + progName.toLowerCase() + ".jar --help'.");

        System.exit(1);
    }
}
