package com.storybuilder.core.grid;

import com.storybuilder.core.model.GridItem;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Orders file names the way people read them: {@code img2} before {@code img10}.
 * Names are split into digit and non-digit runs; digit runs compare numerically, text runs
 * case-insensitively. At a position where one name has digits and the other text, digits sort first.
 */
public final class NaturalOrderComparator implements Comparator<String> {

    public static final NaturalOrderComparator INSTANCE = new NaturalOrderComparator();

    /** Compares grid items by the base name of their path. */
    public static final Comparator<GridItem> BY_BASE_NAME =
        Comparator.comparing(item -> baseName(item.path()), INSTANCE);

    @Override
    public int compare(String left, String right) {
        List<String> a = split(left);
        List<String> b = split(right);
        int shared = Math.min(a.size(), b.size());
        for (int i = 0; i < shared; i++) {
            int result = compareRuns(a.get(i), b.get(i));
            if (result != 0) {
                return result;
            }
        }
        return Integer.compare(a.size(), b.size());
    }

    /**
     * Sorts items in place by natural base-name order. The sort is stable, so equal names keep
     * their input order.
     */
    public static void sortByBaseName(List<GridItem> items) {
        items.sort(BY_BASE_NAME);
    }

    static String baseName(String path) {
        if (path == null) {
            return "";
        }
        int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut < 0 ? path : path.substring(cut + 1);
    }

    static List<String> split(String name) {
        List<String> runs = new ArrayList<>();
        if (name == null || name.isEmpty()) {
            return runs;
        }
        int start = 0;
        boolean digits = Character.isDigit(name.charAt(0));
        for (int i = 1; i < name.length(); i++) {
            boolean current = Character.isDigit(name.charAt(i));
            if (current != digits) {
                runs.add(name.substring(start, i));
                start = i;
                digits = current;
            }
        }
        runs.add(name.substring(start));
        return runs;
    }

    private static int compareRuns(String a, String b) {
        boolean aDigits = Character.isDigit(a.charAt(0));
        boolean bDigits = Character.isDigit(b.charAt(0));
        if (aDigits && bDigits) {
            return new BigInteger(a).compareTo(new BigInteger(b));
        }
        if (aDigits != bDigits) {
            return aDigits ? -1 : 1;
        }
        return a.toLowerCase(Locale.ROOT).compareTo(b.toLowerCase(Locale.ROOT));
    }
}
