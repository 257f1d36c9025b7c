package im.arun.genreport.ged;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Decodes a GEDCOM file of unknown encoding into lines.
 * Prefers UTF-16/UTF-8 (BOM detected), then strict UTF-8, then UTF-8 with a tiny amount of
 * replacement, and finally ISO-8859-1 with repair of double-encoded UTF-8 ("mojibake").
 * Decoding never fails; only an unreadable or empty file is an error.
 */
public class GedTextLoader {
    private static final Logger logger = LoggerFactory.getLogger(GedTextLoader.class);

    /** Highest accepted share of U+FFFD characters when decoding UTF-8 leniently. */
    static final double MAX_REPLACEMENT_RATIO = 0.0005;

    private static final char REPLACEMENT = '\uFFFD';

    /**
     * Read and decode a file.
     *
     * @param path GEDCOM file
     * @return decoded lines without line terminators or NUL characters
     * @throws GedLoadException if the file is missing, unreadable or empty
     */
    public List<String> load(Path path) throws GedLoadException {
        byte[] raw;
        try {
            raw = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new GedLoadException("Input GED not found: " + path, e);
        } catch (IOException e) {
            throw new GedLoadException("Cannot read GED file " + path + ": " + e.getMessage(), e);
        }
        if (raw.length == 0) {
            throw new GedLoadException("GED file is empty: " + path);
        }
        List<String> lines = decode(raw);
        logger.info("Read {} lines from {}", lines.size(), path);
        return lines;
    }

    /**
     * Decode raw bytes into lines.
     */
    public List<String> decode(byte[] raw) {
        if (startsWith(raw, 0xFF, 0xFE) || startsWith(raw, 0xFE, 0xFF)) {
            try {
                logger.debug("UTF-16 byte order mark found");
                return splitLines(strictDecode(raw, 0, StandardCharsets.UTF_16));
            } catch (CharacterCodingException e) {
                logger.debug("UTF-16 decoding failed, trying UTF-8: {}", e.getMessage());
            }
        }

        if (startsWith(raw, 0xEF, 0xBB, 0xBF)) {
            try {
                logger.debug("UTF-8 byte order mark found");
                return splitLines(strictDecode(raw, 3, StandardCharsets.UTF_8));
            } catch (CharacterCodingException e) {
                logger.debug("UTF-8 decoding after BOM failed: {}", e.getMessage());
            }
        }

        try {
            return splitLines(strictDecode(raw, 0, StandardCharsets.UTF_8));
        } catch (CharacterCodingException e) {
            logger.debug("Strict UTF-8 decoding failed: {}", e.getMessage());
        }

        String replaced = new String(raw, StandardCharsets.UTF_8);
        long replacements = replaced.chars().filter(c -> c == REPLACEMENT).count();
        if (replacements > 0 && (double) replacements / Math.max(1, replaced.length()) < MAX_REPLACEMENT_RATIO) {
            logger.debug("Accepting UTF-8 with {} replacement characters", replacements);
            return splitLines(replaced);
        }

        String latin1 = new String(raw, StandardCharsets.ISO_8859_1);
        String fixed = repairMojibake(latin1);
        if (mojibakeScore(fixed) > 0) {
            fixed = fixed.lines()
                .map(GedTextLoader::repairMojibake)
                .collect(Collectors.joining("\n"));
        }
        if (!fixed.equals(latin1)) {
            logger.info("Repaired double-encoded characters (score {} -> {})",
                mojibakeScore(latin1), mojibakeScore(fixed));
        }
        return splitLines(fixed);
    }

    /**
     * Count of characters that typically appear when UTF-8 bytes are read as ISO-8859-1.
     */
    static int mojibakeScore(String s) {
        int score = 0;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\u00C3' || c == '\u00C2' || c == '\u00E2') {
                score++;
            }
        }
        return score;
    }

    /**
     * Re-encode as ISO-8859-1 and decode as UTF-8; keep the result only if it lowers the score.
     */
    static String repairMojibake(String s) {
        int before = mojibakeScore(s);
        if (before == 0) {
            return s;
        }
        try {
            byte[] bytes = encodeLatin1(s, CodingErrorAction.REPORT);
            String fixed = strictDecode(bytes, 0, StandardCharsets.UTF_8);
            if (mojibakeScore(fixed) < before) {
                return fixed;
            }
        } catch (CharacterCodingException e) {
            try {
                byte[] bytes = encodeLatin1(s, CodingErrorAction.IGNORE);
                String fixed = decode(bytes, StandardCharsets.UTF_8, CodingErrorAction.IGNORE);
                if (mojibakeScore(fixed) < before) {
                    return fixed;
                }
            } catch (CharacterCodingException ignored) {
                // IGNORE never reports; keep the decoded text
                logger.trace("Lenient mojibake repair failed", ignored);
            }
        }
        return s;
    }

    private static List<String> splitLines(String text) {
        return text.replace("\0", "").lines().collect(Collectors.toList());
    }

    private static String strictDecode(byte[] raw, int offset, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(raw, offset, raw.length - offset))
            .toString();
    }

    private static String decode(byte[] raw, Charset charset, CodingErrorAction action) throws CharacterCodingException {
        return charset.newDecoder()
            .onMalformedInput(action)
            .onUnmappableCharacter(action)
            .decode(ByteBuffer.wrap(raw))
            .toString();
    }

    private static byte[] encodeLatin1(String s, CodingErrorAction action) throws CharacterCodingException {
        ByteBuffer buffer = StandardCharsets.ISO_8859_1.newEncoder()
            .onMalformedInput(action)
            .onUnmappableCharacter(action)
            .encode(CharBuffer.wrap(s));
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private static boolean startsWith(byte[] raw, int... prefix) {
        if (raw.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if ((raw[i] & 0xFF) != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
