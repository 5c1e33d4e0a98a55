package com.amannm.pdftk.input;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Input files as given on the command line, each either {@code HANDLE=path} or a bare {@code path}.
 */
public record InputFiles(List<Entry> entries) {

    private static final Pattern HANDLE = Pattern.compile("[A-Z]+");

    /**
     * @param handle upper case handle, or {@code null} for a bare path
     * @param path   file path as given
     */
    public record Entry(String handle, Path path) {
    }

    public InputFiles {
        entries = List.copyOf(entries);
    }

    /**
     * Splits {@code HANDLE=path} arguments. Handles are case-insensitive and stored upper case.
     *
     * @throws InvalidHandleException when a handle is not alphabetic or appears twice
     */
    public static InputFiles parse(List<String> inputs) {
        List<Entry> entries = new ArrayList<>(inputs.size());
        Set<String> seen = new HashSet<>();
        for (String input : inputs) {
            int equals = input.indexOf('=');
            if (equals < 0) {
                entries.add(new Entry(null, Path.of(input)));
                continue;
            }
            String handle = input.substring(0, equals).toUpperCase(Locale.ROOT);
            if (!HANDLE.matcher(handle).matches()) {
                throw new InvalidHandleException("Invalid handle '" + input.substring(0, equals)
                    + "' in input '" + input + "': handles are letters only");
            }
            if (!seen.add(handle)) {
                throw new InvalidHandleException("Handle " + handle + " is given to more than one input");
            }
            entries.add(new Entry(handle, Path.of(input.substring(equals + 1))));
        }
        return new InputFiles(entries);
    }

    /**
     * Inputs that were given a handle, in input order.
     */
    public Map<String, Path> handles() {
        Map<String, Path> handles = new LinkedHashMap<>();
        for (Entry entry : entries) {
            if (entry.handle() != null) {
                handles.put(entry.handle(), entry.path());
            }
        }
        return handles;
    }

    /**
     * Every input path in input order.
     */
    public List<Path> files() {
        return entries.stream().map(Entry::path).toList();
    }

    /**
     * Every input by handle. Inputs without one get the next handle not already taken,
     * counting {@code A}, {@code B}, ..., {@code Z}, {@code AA}, {@code AB}, ...
     */
    public Map<String, Path> assignHandles() {
        Set<String> taken = new HashSet<>(handles().keySet());
        Map<String, Path> assigned = new LinkedHashMap<>();
        int next = 0;
        for (Entry entry : entries) {
            String handle = entry.handle();
            if (handle == null) {
                do {
                    handle = letters(next++);
                } while (taken.contains(handle));
                taken.add(handle);
            }
            assigned.put(handle, entry.path());
        }
        return assigned;
    }

    static String letters(int index) {
        StringBuilder handle = new StringBuilder();
        int n = index + 1;
        while (n > 0) {
            n--;
            handle.insert(0, (char) ('A' + n % 26));
            n /= 26;
        }
        return handle.toString();
    }
}
