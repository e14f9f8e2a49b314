/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.edgecv4j.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;

/**
 * Builds a map of options from a command line. An argument starting with a
 * dash names an option. If the following argument doesn't also start with a
 * dash it's taken as that option's value, otherwise the option is recorded
 * with the value {@code "true"}.
 * <P>
 *
 * &nbsp&nbsp java EdgeDetect loose -i image.png -sigma 2.5 -verbose
 * <P>
 *
 * yields {@code i -> image.png}, {@code sigma -> 2.5} and {@code verbose -> true}.
 * Arguments that aren't associated with an option ({@code loose} above) are
 * available from {@link #getNonOptionArgs()}.
 * <P>
 *
 * <B>Note:</B> a negative number can't be passed as an option value since it
 * looks like the next option.
 */
public class CommandLineParser extends HashMap<String, String> {

    private static final long serialVersionUID = 1599477341664265366L;

    private final int totalArgCount;
    private final List<String> nonOptionArgs = new ArrayList<>();

    /**
     * A {@code null} argument list results in an empty map.
     */
    public CommandLineParser(final String[] args) {
        totalArgCount = args == null ? 0 : args.length;
        parse(args);
    }

    public int getTotalArgCount() {
        return totalArgCount;
    }

    public int getOptionCount() {
        return size();
    }

    public List<String> getNonOptionArgs() {
        return Collections.unmodifiableList(nonOptionArgs);
    }

    public String getProperty(final String key) {
        return get(key);
    }

    public String getProperty(final String key, final String defaultValue) {
        final String ret = get(key);
        return ret == null ? defaultValue : ret;
    }

    public boolean hasOption(final String key) {
        return containsKey(key);
    }

    /**
     * Parse the option as a double.
     *
     * @return the value, or {@code null} if the option wasn't given.
     * @throws NumberFormatException if the option was given but isn't a number.
     */
    public Double getDouble(final String key) throws NumberFormatException {
        final String val = get(key);
        if(val == null)
            return null;
        try {
            return Double.valueOf(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new NumberFormatException("The option \"-" + key + "\" requires a number but was given \"" + val + "\"");
        }
    }

    private void parse(final String[] args) {
        if(args == null)
            return;

        for(int i = 0; i < args.length; i++) {
            final String cur = args[i].trim();
            if(cur.isEmpty())
                continue;

            if(cur.charAt(0) == '-' && cur.length() > 1) {
                final String name = cur.substring(1);
                String val = null;
                if(i + 1 < args.length) {
                    final String next = args[i + 1].trim();
                    // a following dash means the option has no value
                    if(!next.isEmpty() && next.charAt(0) != '-') {
                        val = next;
                        i++;
                    }
                }
                put(name, val == null ? "true" : val);
            } else
                nonOptionArgs.add(cur);
        }
    }
}
