package pda.render;

import pda.automaton.Automaton;
import pda.automaton.Transition;

import java.math.BigInteger;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Draws an automaton as ASCII art.
 *
 * Layout: states left to right in natural order ("q2" before "q10"), one box each, final states
 * with a double outline. Self-loop labels sit above their state; every other (from, to) pair
 * gets its own lane below the boxes, with the labels of all rules sharing that pair joined
 * by " | ".
 *
 *       (a,Z,AZ)
 *   .------.       .======.
 *  (   q0   )     ((  q1  ))
 *   `------'       `======'
 *       |              |
 *       +--------------> (b,A,ε)
 */
public final class AsciiRenderer {

    private static final Pattern TRAILING_NUMBER = Pattern.compile("^(\\D*)(\\d+)$");
    private static final int SPACING = 6;
    private static final int BOX_HEIGHT = 3;

    private AsciiRenderer() {
    }

    public static String render(Automaton automaton) {
        List<String> states = sortedStates(automaton.getStates());

        // group labels per (from, to), first-seen order
        Map<String, Map<String, List<String>>> groups = new LinkedHashMap<>();
        for (Transition t : automaton.getTransitions()) {
            groups.computeIfAbsent(t.getFrom(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(t.getTo(), k -> new ArrayList<>())
                    .add(t.label());
        }

        int loopRows = 0;
        for (String s : states) {
            if (groups.containsKey(s) && groups.get(s).containsKey(s)) loopRows++;
        }
        int boxTop = loopRows + 1;

        Canvas canvas = new Canvas();
        Map<String, Integer> centers = new HashMap<>();
        int col = 0;
        for (String s : states) {
            String[] box = box(s, automaton.isFinal(s));
            for (int r = 0; r < box.length; r++) {
                canvas.write(boxTop + r, col, box[r]);
            }
            centers.put(s, col + box[0].length() / 2);
            col += box[0].length() + SPACING;
        }

        // self loops first, so arrow lanes never push them around
        for (String s : states) {
            Map<String, List<String>> targets = groups.get(s);
            if (targets == null || !targets.containsKey(s)) continue;
            String text = "@ " + String.join(" | ", targets.get(s));
            int preferred = Math.max(0, centers.get(s) - text.length() / 2);
            canvas.placeAbove(boxTop - 1, preferred, text);
        }

        int lane = boxTop + BOX_HEIGHT + 1;
        for (String from : states) {
            Map<String, List<String>> targets = groups.get(from);
            if (targets == null) continue;
            for (Map.Entry<String, List<String>> entry : targets.entrySet()) {
                String to = entry.getKey();
                if (to.equals(from)) continue;
                drawArrow(canvas, boxTop + BOX_HEIGHT, lane, centers.get(from), centers.get(to),
                        String.join(" | ", entry.getValue()));
                lane += 2;
            }
        }

        StringBuilder sb = new StringBuilder();
        sb.append("== Automaton ==\n");
        sb.append("States: ").append(String.join(", ", states)).append('\n');
        sb.append("Initial: ").append(automaton.getInitialState())
                .append("   Initial stack: ").append(automaton.getInitialStackSymbol())
                .append("   Final: ").append(String.join(", ", sortedStates(automaton.getFinalStates())))
                .append('\n');
        sb.append('\n');
        sb.append(canvas);
        return sb.toString();
    }

    private static void drawArrow(Canvas canvas, int firstFreeRow, int row, int from, int to, String label) {
        for (int r = firstFreeRow; r < row; r++) {
            canvas.putIfEmpty(r, from, '|');
            canvas.putIfEmpty(r, to, '|');
        }
        canvas.put(row, from, '+');
        if (from < to) {
            for (int c = from + 1; c < to; c++) canvas.put(row, c, '-');
            canvas.put(row, to, '>');
        } else {
            for (int c = to + 1; c < from; c++) canvas.put(row, c, '-');
            canvas.put(row, to, '<');
        }
        canvas.write(row, Math.max(from, to) + 2, label);
    }

    static String[] box(String name, boolean accepting) {
        int inner = Math.max(name.length() + 4, 6);
        String label = center(name, inner);
        if (accepting) {
            String edge = repeat('=', inner);
            return new String[]{
                    "  ." + edge + ".  ",
                    " ((" + label + ")) ",
                    "  `" + edge + "'  "
            };
        }
        String edge = repeat('-', inner);
        return new String[]{
                "  ." + edge + ".  ",
                "  (" + label + ")  ",
                "  `" + edge + "'  "
        };
    }

    /**
     * Natural order: a common prefix followed by a number sorts numerically.
     */
    static List<String> sortedStates(Collection<String> states) {
        List<String> sorted = new ArrayList<>(states);
        sorted.sort((a, b) -> {
            Matcher ma = TRAILING_NUMBER.matcher(a);
            Matcher mb = TRAILING_NUMBER.matcher(b);
            if (ma.matches() && mb.matches() && ma.group(1).equals(mb.group(1))) {
                int cmp = new BigInteger(ma.group(2)).compareTo(new BigInteger(mb.group(2)));
                if (cmp != 0) return cmp;
            }
            return a.compareTo(b);
        });
        return sorted;
    }

    private static String center(String text, int width) {
        int left = (width - text.length()) / 2;
        int right = width - text.length() - left;
        return repeat(' ', left) + text + repeat(' ', right);
    }

    private static String repeat(char ch, int n) {
        char[] chars = new char[Math.max(0, n)];
        Arrays.fill(chars, ch);
        return new String(chars);
    }

    /**
     * Growable character grid.
     */
    private static final class Canvas {
        private final List<StringBuilder> rows = new ArrayList<>();

        private StringBuilder row(int r, int minWidth) {
            while (rows.size() <= r) rows.add(new StringBuilder());
            StringBuilder sb = rows.get(r);
            while (sb.length() < minWidth) sb.append(' ');
            return sb;
        }

        void put(int r, int c, char ch) {
            row(r, c + 1).setCharAt(c, ch);
        }

        void putIfEmpty(int r, int c, char ch) {
            StringBuilder sb = row(r, c + 1);
            if (sb.charAt(c) == ' ') sb.setCharAt(c, ch);
        }

        void write(int r, int c, String text) {
            StringBuilder sb = row(r, c + text.length());
            for (int i = 0; i < text.length(); i++) {
                sb.setCharAt(c + i, text.charAt(i));
            }
        }

        boolean fits(int r, int c, String text) {
            StringBuilder sb = row(r, c + text.length());
            for (int i = 0; i < text.length(); i++) {
                if (sb.charAt(c + i) != ' ') return false;
            }
            return true;
        }

        /**
         * Write at the first free spot from {@code startRow} upwards; overwrite row 0 as a last resort.
         */
        void placeAbove(int startRow, int col, String text) {
            for (int r = startRow; r >= 0; r--) {
                if (fits(r, col, text)) {
                    write(r, col, text);
                    return;
                }
            }
            write(0, col, text);
        }

        @Override
        public String toString() {
            StringBuilder out = new StringBuilder();
            boolean leading = true;
            for (StringBuilder sb : rows) {
                String line = sb.toString().replaceAll("\\s+$", "");
                if (leading && line.isEmpty()) continue;
                leading = false;
                out.append(line).append('\n');
            }
            return out.toString();
        }
    }
}
