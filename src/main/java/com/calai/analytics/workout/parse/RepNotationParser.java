package com.calai.analytics.workout.parse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 次數記法解析：
 * - 逗號："8,10,12" → [8, 10, 12]（非數字或負數 token 直接丟掉）
 * - 區間："8-12" → [10]（四捨五入的中點，只代表一組）
 * - 單值："10" → [10]
 * 任何格式錯誤都降級處理，不丟例外、不回空 list（最差回 [0]）。
 */
public final class RepNotationParser {
    private RepNotationParser() {}

    private static final List<Integer> ZERO = List.of(0);

    public static List<Integer> parse(String notation) {
        if (notation == null || notation.isBlank()) return ZERO;
        String s = notation.trim();

        if (s.indexOf(',') >= 0) {
            List<Integer> out = new ArrayList<>();
            for (String token : s.split(",")) {
                Integer v = parseRepsOrNull(token);
                if (v != null) out.add(v);
            }
            return out.isEmpty() ? ZERO : Collections.unmodifiableList(out);
        }

        if (s.indexOf('-') >= 0) {
            String[] bounds = s.split("-", -1);
            if (bounds.length < 2) return ZERO;
            Integer low = parseRepsOrNull(bounds[0]);
            Integer high = parseRepsOrNull(bounds[1]);
            if (low == null || high == null) return ZERO;
            return List.of((int) Math.round(((double) low + high) / 2.0));
        }

        Integer single = parseRepsOrNull(s);
        return single == null ? ZERO : List.of(single);
    }

    /** 用 long 累加，長串逗號清單不會溢位 */
    public static long sum(List<Integer> reps) {
        long total = 0;
        for (Integer r : reps) total += (r == null ? 0 : r);
        return total;
    }

    /** 以逗號格式存回 DB */
    public static String format(List<Integer> reps) {
        return reps.stream().map(String::valueOf).collect(Collectors.joining(","));
    }

    /** 次數不可能是負的：負數跟非數字一樣當作無效 token */
    private static Integer parseRepsOrNull(String raw) {
        Integer v = parseIntOrNull(raw);
        return (v == null || v < 0) ? null : v;
    }

    private static Integer parseIntOrNull(String raw) {
        if (raw == null) return null;
        String t = raw.trim();
        if (t.isEmpty()) return null;
        try {
            return Integer.parseInt(t);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
