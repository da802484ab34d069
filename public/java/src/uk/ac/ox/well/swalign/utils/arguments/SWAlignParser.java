package uk.ac.ox.well.swalign.utils.arguments;

import com.google.common.base.Joiner;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.Parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Groups every value that follows an option under that option, so repeated values can be given either as
 * "-x a b" or "-x a,b".  Tokens that look like numbers (e.g. a negative penalty) are values, not options.
 */
public class SWAlignParser extends Parser {
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    @Override
    protected String[] flatten(Options options, String[] strings, boolean stopAtNonOption) {
        Map<Option, List<String>> arguments = new LinkedHashMap<>();

        Option currentOption = null;

        for (String token : strings) {
            if (token.startsWith("-") && !NUMBER.matcher(token).matches()) {
                if (options.hasOption(token)) {
                    currentOption = options.getOption(token);

                    if (!arguments.containsKey(currentOption)) {
                        arguments.put(currentOption, new ArrayList<>());
                    }
                } else {
                    throw new IllegalArgumentException("The option '" + token + "' is not a recognized option");
                }
            } else {
                if (currentOption != null) {
                    arguments.get(currentOption).add(token);
                }
            }
        }

        List<String> args = new ArrayList<>();
        for (Option option : arguments.keySet()) {
            args.add("--" + option.getLongOpt());

            if (option.hasArg()) {
                args.add(Joiner.on(",").join(arguments.get(option)));
            }
        }

        return args.toArray(new String[args.size()]);
    }
}
