package uk.ac.ox.well.swalign.utils.packageutils;

import com.google.common.base.Joiner;
import org.apache.commons.lang.time.DurationFormatUtils;
import uk.ac.ox.well.swalign.Main;
import uk.ac.ox.well.swalign.commands.Module;
import uk.ac.ox.well.swalign.utils.arguments.Output;
import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;
import uk.ac.ox.well.swalign.utils.performance.PerformanceUtils;

import java.io.PrintStream;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.util.*;

/**
 * Instantiates a module and passes it command-line arguments.
 */
public class Dispatch {
    /**
     * Private constructor - this class cannot be instantiated!
     */
    private Dispatch() {}

    /**
     * Main method for instantiating SWAlign modules
     *
     * @param module      the module class
     * @param moduleArgs  the arguments for the module
     */
    public static void main(Class<? extends Module> module, String[] moduleArgs) {
        try {
            Main.getLogger().info("{}", getBanner());
            Main.getLogger().info("java -jar swalign.jar {} {}", module.getSimpleName(), Joiner.on(" ").join(moduleArgs));
            Main.getLogger().info("");

            Module instance = module.getDeclaredConstructor().newInstance();
            instance.args = moduleArgs;

            Field[] instanceFields = instance.getClass().getDeclaredFields();
            Field[] superFields = instance.getClass().getSuperclass().getDeclaredFields();

            List<Field> fields = new ArrayList<>();
            fields.addAll(Arrays.asList(instanceFields));
            fields.addAll(Arrays.asList(superFields));

            instance.init();

            Date startTime = new Date();

            instance.execute();

            for (Field field : fields) {
                for (Annotation annotation : field.getDeclaredAnnotations()) {
                    if (annotation.annotationType().equals(Output.class)) {
                        field.setAccessible(true);
                        if (field.get(instance) instanceof PrintStream) {
                            ((PrintStream) field.get(instance)).close();
                        }
                    }
                }
            }

            Date elapsedTime = new Date((new Date()).getTime() - startTime.getTime());

            Main.getLogger().info("");
            Main.getLogger().info("Complete. (time) {}; (mem) {}",
                                  DurationFormatUtils.formatDurationHMS(elapsedTime.getTime()),
                                  PerformanceUtils.getCompactMemoryUsageStats() );
        } catch (NoSuchMethodException | InvocationTargetException | IllegalAccessException | InstantiationException e) {
            throw new SWAlignException("Unable to run module '" + module.getSimpleName() + "'", e);
        }
    }

    private static String getBanner() {
        Properties prop = Main.getBuildProperties();

        if (prop != null) {
            String version = prop.getProperty("version");
            String buildDate = prop.getProperty("build.date");
            return Main.progName + " " + version + "; (build) " + buildDate;
        } else {
            return Main.progName + " unknown version; unknown build time";
        }
    }
}
