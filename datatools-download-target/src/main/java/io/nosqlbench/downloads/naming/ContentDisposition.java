package io.nosqlbench.downloads.naming;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// A parsed `Content-Disposition` header.
///
/// Recognizes the `filename` and RFC 5987 `filename*` parameters. The extended form wins
/// when both are present. Plain `filename` values may be percent-encoded, and raw 8-bit
/// values are decoded with the referrer charset when one is supplied.
public final class ContentDisposition {
    private static final Logger logger = LogManager.getLogger(ContentDisposition.class);

    private final String type;
    private final String filename;

    private ContentDisposition(String type, String filename) {
        this.type = type;
        this.filename = filename;
    }

    /// @param header the raw header value, possibly null
    /// @param referrerCharset the charset for undeclared 8-bit values, possibly empty
    /// @return the parsed header; never null
    public static ContentDisposition parse(String header, String referrerCharset) {
        if (header == null || header.isBlank()) {
            return new ContentDisposition("", "");
        }
        String[] parts = splitParams(header);
        String type = parts[0].trim().toLowerCase(Locale.ROOT);
        if (type.contains("=")) {
            // some servers omit the disposition type
            type = "";
        }
        String plain = null;
        String extended = null;
        for (int i = type.isEmpty() ? 0 : 1; i < parts.length; i++) {
            String part = parts[i].trim();
            int eq = part.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String name = part.substring(0, eq).trim().toLowerCase(Locale.ROOT);
            String value = unquote(part.substring(eq + 1).trim());
            if (name.equals("filename") && plain == null) {
                plain = decodePlain(value, referrerCharset);
            } else if (name.equals("filename*") && extended == null) {
                extended = decodeExtended(value).orElse(null);
            }
        }
        String chosen = extended != null ? extended : plain != null ? plain : "";
        return new ContentDisposition(type, chosen);
    }

    public String type() {
        return type;
    }

    public boolean isAttachment() {
        return type.equals("attachment");
    }

    /// @return the decoded file name, or "" when absent
    public String filename() {
        return filename;
    }

    public boolean hasFilename() {
        return !filename.isEmpty();
    }

    private static String[] splitParams(String header) {
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < header.length(); i++) {
            char c = header.charAt(i);
            if (c == '"') {
                quoted = !quoted;
            } else if (c == '\\' && quoted && i + 1 < header.length()) {
                current.append(c).append(header.charAt(++i));
                continue;
            }
            if (c == ';' && !quoted) {
                out.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        out.add(current.toString());
        return out.toArray(new String[0]);
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            StringBuilder sb = new StringBuilder();
            for (int i = 1; i < value.length() - 1; i++) {
                char c = value.charAt(i);
                if (c == '\\' && i + 1 < value.length() - 1) {
                    c = value.charAt(++i);
                }
                sb.append(c);
            }
            return sb.toString();
        }
        return value;
    }

    private static String decodePlain(String value, String referrerCharset) {
        String decoded = value;
        if (value.indexOf('%') >= 0) {
            Optional<byte[]> bytes = percentDecode(value);
            if (bytes.isPresent()) {
                decoded = decodeStrict(bytes.get(), StandardCharsets.UTF_8).orElse(value);
            }
        }
        if (hasHighLatin1Only(decoded) && referrerCharset != null && !referrerCharset.isEmpty()) {
            byte[] raw = decoded.getBytes(StandardCharsets.ISO_8859_1);
            Optional<String> viaUtf8 = decodeStrict(raw, StandardCharsets.UTF_8);
            if (viaUtf8.isPresent()) {
                return viaUtf8.get();
            }
            Optional<Charset> charset = charset(referrerCharset);
            if (charset.isPresent()) {
                return decodeStrict(raw, charset.get()).orElse(decoded);
            }
        }
        return decoded;
    }

    /// Decodes `charset'lang'percent-encoded` values.
    private static Optional<String> decodeExtended(String value) {
        int first = value.indexOf('\'');
        int second = first < 0 ? -1 : value.indexOf('\'', first + 1);
        if (second < 0) {
            logger.debug("Malformed extended filename parameter: {}", value);
            return Optional.empty();
        }
        Optional<Charset> charset = charset(value.substring(0, first));
        if (charset.isEmpty()) {
            return Optional.empty();
        }
        return percentDecode(value.substring(second + 1)).flatMap(b -> decodeStrict(b, charset.get()));
    }

    private static Optional<byte[]> percentDecode(String value) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%') {
                if (i + 2 >= value.length()) {
                    return Optional.empty();
                }
                int hi = Character.digit(value.charAt(i + 1), 16);
                int lo = Character.digit(value.charAt(i + 2), 16);
                if (hi < 0 || lo < 0) {
                    return Optional.empty();
                }
                out.write((hi << 4) | lo);
                i += 2;
            } else {
                byte[] b = String.valueOf(c).getBytes(StandardCharsets.UTF_8);
                out.write(b, 0, b.length);
            }
        }
        return Optional.of(out.toByteArray());
    }

    private static Optional<String> decodeStrict(byte[] bytes, Charset charset) {
        try {
            return Optional.of(charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString());
        } catch (CharacterCodingException e) {
            return Optional.empty();
        }
    }

    private static Optional<Charset> charset(String name) {
        try {
            return Optional.of(Charset.forName(name.trim()));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            logger.debug("Unknown charset '{}' in content disposition", name);
            return Optional.empty();
        }
    }

    private static boolean hasHighLatin1Only(String s) {
        boolean high = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c > 0xFF) {
                return false;
            }
            high |= c >= 0x80;
        }
        return high;
    }
}
