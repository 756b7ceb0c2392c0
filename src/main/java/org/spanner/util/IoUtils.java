/**
 * Copyright 2021 the original author or authors. A Cloud Spanner script driver.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0

 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.spanner.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * @since 2021-03-08
 *
 */
public final class IoUtils {
    static final Logger log = LoggerFactory.getLogger(IoUtils.class);

    public static final int BUFFER_SIZE = Integer.getInteger("spanner.driver.io.bufferSize", 8192);

    private IoUtils() {}

    public static final void close(AutoCloseable closeable) {
        if(closeable != null) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.debug("Close {} error", closeable, e);
            }
        }
    }

    public static String readString(Reader reader) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] buffer = new char[BUFFER_SIZE];
        for (int n = reader.read(buffer); n != -1; n = reader.read(buffer)) {
            sb.append(buffer, 0, n);
        }
        return sb.toString();
    }

    public static String readString(InputStream in, Charset charset) throws IOException {
        return readString(new InputStreamReader(in, charset));
    }

    public static String readString(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

}
