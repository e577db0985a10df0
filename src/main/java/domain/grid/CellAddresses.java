package domain.grid;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A1-style address helpers for qualified range references such as {@code 'My Sheet'!$A$1:$C$4}.
 */
public final class CellAddresses {

    private static final Pattern AREA = Pattern.compile(
            "\\$?([A-Za-z]{1,3})\\$?(\\d+)(?::\\$?([A-Za-z]{1,3})\\$?(\\d+))?");

    private CellAddresses() {
    }

    /**
     * Sheet name part of a qualified address: everything before '!', with surrounding
     * single quotes stripped and doubled quotes unescaped. Null when there is no '!'.
     */
    public static String sheetOf(String qualifiedAddress) {
        if (qualifiedAddress == null) return null;
        String s = qualifiedAddress.trim();
        if (s.startsWith("=")) s = s.substring(1);
        int bang = s.lastIndexOf('!');
        if (bang <= 0) return null;
        String sheet = s.substring(0, bang);
        if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
            sheet = sheet.substring(1, sheet.length() - 1).replace("''", "'");
        }
        return sheet;
    }

    /**
     * Area part of a qualified address, or null if it is not a single contiguous A1 area.
     */
    public static CellArea areaOf(String qualifiedAddress) {
        if (qualifiedAddress == null) return null;
        String s = qualifiedAddress.trim();
        int bang = s.lastIndexOf('!');
        if (bang >= 0) s = s.substring(bang + 1);

        Matcher m = AREA.matcher(s);
        if (!m.matches()) return null;

        int r1 = Integer.parseInt(m.group(2));
        int c1 = columnIndex(m.group(1));
        int r2 = m.group(4) == null ? r1 : Integer.parseInt(m.group(4));
        int c2 = m.group(3) == null ? c1 : columnIndex(m.group(3));
        if (r1 < 1 || r2 < 1) return null;

        return new CellArea(Math.min(r1, r2), Math.min(c1, c2), Math.max(r1, r2), Math.max(c1, c2));
    }

    /** 1-based column number to letters: 1 -> A, 27 -> AA. */
    public static String columnLetters(int column) {
        if (column < 1) throw new IllegalArgumentException("column must be >= 1: " + column);
        StringBuilder sb = new StringBuilder();
        int c = column;
        while (c > 0) {
            int rem = (c - 1) % 26;
            sb.append((char) ('A' + rem));
            c = (c - 1) / 26;
        }
        return sb.reverse().toString();
    }

    /** Letters to 1-based column number: A -> 1, AA -> 27. */
    public static int columnIndex(String letters) {
        int n = 0;
        for (char ch : letters.toUpperCase(Locale.ROOT).toCharArray()) {
            n = n * 26 + (ch - 'A' + 1);
        }
        return n;
    }

    public static String formatArea(CellArea area) {
        String start = "$" + columnLetters(area.getFirstColumn()) + "$" + area.getFirstRow();
        if (area.rows() == 1 && area.columns() == 1) return start;
        return start + ":$" + columnLetters(area.getLastColumn()) + "$" + area.getLastRow();
    }

    public static String qualify(String sheet, CellArea area) {
        return quoteSheet(sheet) + "!" + formatArea(area);
    }

    static String quoteSheet(String sheet) {
        if (sheet.matches("[A-Za-z_][A-Za-z0-9_.]*")) return sheet;
        return "'" + sheet.replace("'", "''") + "'";
    }
}
