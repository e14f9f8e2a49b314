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

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Enumeration;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PropertiesUtils {
    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesUtils.class);

    public static final String separator = ".";

    /**
     * Extract the entries of {@code props} that live under {@code sectionName}. If
     * {@code removeSectionName} is set then "section.key" comes back as "key".
     */
    public static Properties getSection(final Properties props, final String sectionName, final boolean removeSectionName) {
        final Properties ret = new Properties();
        final String prefix = sectionName + separator;

        for(final Enumeration<?> e = props.propertyNames(); e.hasMoreElements();) {
            final String key = (String)(e.nextElement());
            if(key.startsWith(prefix)) {
                final String newkey = removeSectionName ? key.substring(prefix.length()) : key;
                ret.setProperty(newkey, props.getProperty(key));
            } else if(key.equals(sectionName) && !removeSectionName) {
                ret.setProperty(key, props.getProperty(key));
            }
        }

        return ret;
    }

    /**
     * @throws java.io.FileNotFoundException if {@code fname} can't be opened
     */
    public static Properties loadProps(final String fname) throws IOException {
        try(InputStream is = new FileInputStream(fname);) {
            final Properties ret = loadProps(is);
            LOGGER.debug("Loaded {} properties from \"{}\"", ret.size(), fname);
            return ret;
        }
    }

    public static Properties loadProps(final InputStream is) throws IOException {
        final Properties ret = new Properties();
        ret.load(is);
        return ret;
    }
}
