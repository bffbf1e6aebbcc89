/*
 * @LICENSE@
 */

package org.rxnfa.regex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * This class implements a bunch of possibly reusable, miscelaneous static
 * objects, interfaces, classes, and methods.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for Strings
     */
    static Iterable<Character> iterize(final CharSequence cs) {
        return new Iterable<Character>() {
            public Iterator<Character> iterator() {
                return new Iterator<Character>() {
                    private int i = 0;

                    public boolean hasNext() {
                        return i < cs.length();
                    }

                    public Character next() {
                        return cs.charAt(i++);
                    }

                    public void remove() {
                        throw new UnsupportedOperationException();
                    }
                };
            }
        };
    }

    static final class FlagMgr {

        private List<String> labels = new ArrayList<String>(4);
        private int defined = 0;
        private Integer implemented = null;
        boolean frozen = false;

        private boolean contains(int f, int g) {
            return (g | f) == f;
        }

        int next(String label) {
            if (frozen)
                throw new IllegalStateException("frozen FlagMgr");
            labels.add(label);
            int flag = 1 << (labels.size() - 1);
            defined |= flag;
            return flag;
        }

        int freezeAndCount() {
            frozen = true;
            return labels.size();
        }

        FlagMgr setImplemented(int implemented) {
            if (!contains(defined, implemented)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (implemented & ~defined));
            }
            this.implemented = implemented;
            return this;
        }

        void check(int flags) {
            if (!contains(defined, flags)) {
                throw new IllegalArgumentException(
                    "unknown flags: " + (flags & ~defined));
            } else if (!contains(implemented, flags)) {
                throw new IllegalArgumentException(
                    "unimplemented flags: " + stringFrom(flags & ~implemented));
            }
        }

        String stringFrom(int flags) {
            StringBuilder sb = new StringBuilder();
            int n = 0;
            while (flags != 0) {
                for (; (flags & 1) == 0; flags >>= 1, ++n)
                    ;
                sb.append(sb.length() == 0 ? "" : ", ").append(labels.get(n));
                flags &= ~1;
            }
            return sb.toString();
        }
    }

    static boolean isSet(int flags, int FLAG) {
        return (flags & FLAG) != 0;
    }

    private static abstract class Escaper {
        abstract boolean esc(StringBuilder sb, int c);
    }

    private static final class MapEscaper extends Escaper {
        private final Map<Character, String> map =
                new HashMap<Character, String>();

        public boolean esc(StringBuilder sb, int c) {
            boolean ret = (c == (char) c) ? map.containsKey((char) c) : false;
            if (ret)
                sb.append(map.get((char) c));
            return ret;
        }

        MapEscaper map(Character c, String s) {
            map.put(c, s);
            return this;
        }
    }

    private static final MapEscaper rxEscaper =
            new MapEscaper().map('\\', "\\\\").map('\r', "\\r").map('\n', "\\n")
                .map('\t', "\\t").map('\f', "\\f");

    // everything the converter treats as syntax, '.' included
    private static final MapEscaper rxpEscaper =
            new MapEscaper().map('.', "\\.").map('|', "\\|").map('*', "\\*")
                .map('+', "\\+").map('?', "\\?").map('(', "\\(").map(')', "\\)");

    private static final Escaper unicodeEscaper = new Escaper() {
        public boolean esc(StringBuilder sb, int c) {
            boolean ret = false;
            if (c < 0) {
                sb.append("0x" + Integer.toHexString(c));
                ret = true;
            } else if (c < 32 || 126 < c) {
                int mark = sb.length();
                sb.append(Integer.toHexString(c));
                while (sb.length() - mark < 4) {
                    sb.insert(mark, "0");
                }
                sb.insert(mark, "\\u");
                ret = true;
            }
            return ret;
        }
    };

    /**
     * A collection of singleton objects which implement methods used to create
     * Strings where certain characters are replaced by escape sequences.
     */
    enum Esc {

        /**
         * Regex escaper - escapes backslash and some ASCII ctl,
         * non-printable-ASCII and beyond -> \\u codes
         */
        RX(rxEscaper, unicodeEscaper),
        /**
         * Regex Pattern escaper - escapes as RX plus the operator and grouping
         * metachars, so the output reads back as the same literals.
         */
        RXP(rxEscaper, rxpEscaper, unicodeEscaper);

        private final Escaper[] path;

        Esc(final Escaper... path) {
            this.path = path;
        }

        void esc(StringBuilder sb, int c) {
            for (Escaper e : path) {
                if (e.esc(sb, c))
                    return;
            }
            sb.append((char) c);
        }

        String esc(int c) {
            StringBuilder sb = new StringBuilder();
            esc(sb, c);
            return sb.toString();
        }

        void esc(StringBuilder sb, CharSequence cs) {
            for (char c : iterize(cs)) {
                esc(sb, c);
            }
        }

        String esc(CharSequence cs) {
            StringBuilder sb = new StringBuilder();
            esc(sb, cs);
            return sb.toString();
        }
    }
}
