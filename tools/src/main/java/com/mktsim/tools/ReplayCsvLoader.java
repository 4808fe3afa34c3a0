package com.mktsim.tools;

import com.mktsim.common.SimTime;
import com.mktsim.engine.agent.ReplayRecord;
import com.mktsim.protocol.Side;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a replay order stream from CSV.
 *
 * Format (header line optional, '#' starts a comment):
 *   time,orderId,side,price,size
 *
 * time is nanoseconds since the epoch or an ISO-8601 timestamp; side is
 * BUY/SELL (or B/S); price is integer cents.
 */
public final class ReplayCsvLoader {

    private ReplayCsvLoader() {}

    public static List<ReplayRecord> load(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        }
    }

    static List<ReplayRecord> parse(BufferedReader reader) throws IOException {
        List<ReplayRecord> records = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (lineNo == 1 && line.toLowerCase().startsWith("time")) continue;

            String[] f = line.split(",");
            if (f.length != 5) {
                throw new IOException("Line " + lineNo + ": expected 5 fields, got " + f.length + ": " + line);
            }
            try {
                records.add(new ReplayRecord(
                        parseTime(f[0].trim()),
                        Long.parseLong(f[1].trim()),
                        parseSide(f[2].trim()),
                        Long.parseLong(f[3].trim()),
                        Long.parseLong(f[4].trim())));
            } catch (RuntimeException e) {
                throw new IOException("Line " + lineNo + ": " + e.getMessage(), e);
            }
        }
        return records;
    }

    private static long parseTime(String s) {
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return SimTime.parse(s);
        }
        return Long.parseLong(s);
    }

    private static Side parseSide(String s) {
        return switch (s.toUpperCase()) {
            case "BUY", "B" -> Side.BUY;
            case "SELL", "S" -> Side.SELL;
            default -> throw new IllegalArgumentException("Unknown side: " + s);
        };
    }
}
