package io.cscan.source;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes C comments line by line without changing the number of lines.
 * <p>
 * A block comment may span lines. The text it covers is dropped and a closed comment
 * leaves a single space, so tokens on either side of it stay apart.
 * String literals are not recognized, so comment markers inside quotes are stripped too.
 */
public final class CommentStripper {

    private CommentStripper() {
    }

    public static List<String> strip(List<String> lines) {
        List<String> result = new ArrayList<>(lines.size());
        boolean inBlock = false;
        for (String line : lines) {
            StringBuilder out = new StringBuilder(line.length());
            int i = 0;
            while (i < line.length()) {
                if (inBlock) {
                    int end = line.indexOf("*/", i);
                    if (end < 0) {
                        i = line.length();
                    } else {
                        inBlock = false;
                        out.append(' ');
                        i = end + 2;
                    }
                    continue;
                }
                char c = line.charAt(i);
                if (c == '/' && i + 1 < line.length()) {
                    char next = line.charAt(i + 1);
                    if (next == '/') {
                        break;
                    }
                    if (next == '*') {
                        inBlock = true;
                        i += 2;
                        continue;
                    }
                }
                out.append(c);
                i++;
            }
            result.add(out.toString());
        }
        return result;
    }
}
