package uk.ac.ox.well.swalign.utils.arguments;

import com.google.common.base.Joiner;
import org.apache.commons.cli.*;
import uk.ac.ox.well.swalign.commands.Command;
import uk.ac.ox.well.swalign.utils.alignment.sw.SimilarityTable;
import uk.ac.ox.well.swalign.utils.exceptions.SWAlignException;

import java.io.*;
import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Fills the {@link Argument} and {@link Output} fields of a command from its command-line arguments.
 */
public class ArgumentHandler {
    private ArgumentHandler() {}

    public static void parse(Command instance, String[] args) {
        try {
            Options options = new Options();

            List<Field> fields = getAnnotatedFields(instance);

            int numArgFields = 0;

            for (Field field : fields) {
                for (Annotation annotation : field.getDeclaredAnnotations()) {
                    if (annotation.annotationType().equals(Argument.class)) {
                        numArgFields++;

                        Argument arg = (Argument) annotation;

                        List<String> descElements = new ArrayList<>();

                        if (field.get(instance) != null) {
                            descElements.add("default: " + field.get(instance));
                        }

                        if (field.getType().isEnum()) {
                            descElements.add("one of: " + Joiner.on(", ").join(field.getType().getEnumConstants()));
                        }

                        if (!arg.required()) {
                            descElements.add("optional");
                        }

                        String description = arg.doc();
                        if (descElements.size() > 0) {
                            description += " [" + Joiner.on(", ").join(descElements) + "]";
                        }

                        boolean hasArgument = !field.getType().equals(Boolean.class);

                        Option option = new Option(arg.shortName(), arg.fullName(), hasArgument, description);
                        option.setType(field.getType());
                        options.addOption(option);
                    } else if (annotation.annotationType().equals(Output.class)) {
                        numArgFields++;

                        Output out = (Output) annotation;

                        String description = out.doc() + " [default: " + (field.getType().equals(PrintStream.class) ? "/dev/stdout" : "/dev/null") + "]";

                        Option option = new Option(out.shortName(), out.fullName(), true, description);
                        option.setType(field.getType());
                        options.addOption(option);
                    }
                }
            }

            options.addOption("h", "help", false, "Show this help message");

            CommandLineParser parser = new SWAlignParser();
            CommandLine cmd = parser.parse(options, args);

            if (cmd.hasOption("help") || (numArgFields > 0 && args.length == 0)) {
                int width = System.getenv("COLUMNS") == null ? 100 : Integer.valueOf(System.getenv("COLUMNS"));

                Description d = instance.getClass().getAnnotation(Description.class);
                String header = (d == null) ? "no description available" : d.text();
                String command = "java -jar swalign.jar " + instance.getClass().getSimpleName() + " [arguments]";
                String footer = "";

                HelpFormatter formatter = new HelpFormatter();
                formatter.setWidth(width);
                formatter.setSyntaxPrefix("Usage: ");

                System.out.println();
                formatter.printHelp(command, header, options, footer, false);
                System.out.println();

                System.exit(1);
            }

            for (Field field : fields) {
                for (Annotation annotation : field.getDeclaredAnnotations()) {
                    if (annotation.annotationType().equals(Argument.class)) {
                        Argument arg = (Argument) annotation;

                        if (field.getType().equals(Boolean.class)) {
                            if (cmd.hasOption(arg.fullName())) {
                                Boolean prevValue = (Boolean) field.get(instance);
                                field.set(instance, prevValue == null || !prevValue);
                            }
                        } else {
                            String value = cmd.getOptionValue(arg.fullName());

                            if (value != null) {
                                field.set(instance, handleArgumentTypes(field.getType(), value));
                            } else if (arg.required() && field.get(instance) == null) {
                                throw new SWAlignException("The argument '--" + arg.fullName() + "' was not specified and is required");
                            }
                        }
                    } else if (annotation.annotationType().equals(Output.class)) {
                        Output out = (Output) annotation;

                        String value = cmd.getOptionValue(out.fullName());

                        if (value == null) {
                            value = field.getType().equals(PrintStream.class) ? "/dev/stdout" : "/dev/null";
                        }

                        field.set(instance, handleArgumentTypes(field.getType(), value));
                    }
                }
            }
        } catch (ParseException | IllegalArgumentException e) {
            throw new SWAlignException("Error when parsing command-line arguments: " + e.getMessage(), e);
        } catch (IllegalAccessException e) {
            throw new SWAlignException("Error when accessing field: " + e.getMessage(), e);
        }
    }

    private static List<Field> getAnnotatedFields(Command instance) {
        Field[] instanceFields = instance.getClass().getDeclaredFields();
        Field[] superFields = instance.getClass().getSuperclass().getDeclaredFields();

        List<Field> fields = new ArrayList<>();
        fields.addAll(Arrays.asList(instanceFields));
        fields.addAll(Arrays.asList(superFields));

        for (Field field : fields) {
            field.setAccessible(true);
        }

        return fields;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    static Object handleArgumentTypes(Class<?> type, String value) {
        try {
            if (type.equals(Integer.class)) {
                return Integer.valueOf(value);
            } else if (type.equals(Long.class)) {
                return Long.valueOf(value);
            } else if (type.equals(Double.class)) {
                return Double.valueOf(value);
            } else if (type.equals(String.class)) {
                return value;
            } else if (type.isEnum()) {
                return Enum.valueOf((Class<Enum>) type, value.toUpperCase());
            } else if (type.equals(SimilarityTable.class)) {
                return SimilarityTable.fromName(value);
            } else if (type.equals(PrintStream.class)) {
                FileOutputStream fdout = new FileOutputStream(value);
                BufferedOutputStream bos = new BufferedOutputStream(fdout, 1048576);
                return new PrintStream(bos, false);
            } else if (type.equals(File.class)) {
                return new File(value);
            } else {
                throw new SWAlignException("Unable to automatically handle argument of type '" + type.getSimpleName() + "'");
            }
        } catch (FileNotFoundException e) {
            throw new SWAlignException("Unable to process argument of type '" + type.getSimpleName() + "' and value '" + value + "'", e);
        } catch (IllegalArgumentException e) {
            throw new SWAlignException("Invalid value '" + value + "' for argument of type '" + type.getSimpleName() + "'", e);
        }
    }
}
