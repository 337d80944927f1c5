package com.example.Microgrid_Dispatch.input;

import com.example.Microgrid_Dispatch.exception.DispatchConfigurationException;
import com.example.Microgrid_Dispatch.model.HorizonInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads hourly series from CSV
 *
 * Expected header: {@code timestamp,load_kw,solar_pu[,temp_c]}. Columns are
 * located by name, so extra columns and a different order are fine. The
 * timestamp is the first column and may use a space or 'T' between date and
 * time. Every malformed row is reported, not just the first.
 */
@Component
public class CsvHorizonReader {

    private static final Logger logger = LoggerFactory.getLogger(CsvHorizonReader.class);

    static final String LOAD_COLUMN = "load_kw";
    static final String SOLAR_COLUMN = "solar_pu";
    static final String TEMPERATURE_COLUMN = "temp_c";

    public List<HourlyRecord> read(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<HourlyRecord> records = read(reader);
            logger.info("Read {} hourly records from {}", records.size(), file);
            return records;
        }
    }

    public List<HourlyRecord> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);

        String header = reader.readLine();
        if (header == null) {
            throw new DispatchConfigurationException(List.of("CSV input is empty"));
        }
        List<String> columns = Arrays.asList(header.trim().toLowerCase().split("\\s*,\\s*"));
        int loadIndex = columns.indexOf(LOAD_COLUMN);
        int solarIndex = columns.indexOf(SOLAR_COLUMN);
        int temperatureIndex = columns.indexOf(TEMPERATURE_COLUMN);
        if (loadIndex < 0 || solarIndex < 0) {
            throw new DispatchConfigurationException(List.of(
                    "CSV header must contain " + LOAD_COLUMN + " and " + SOLAR_COLUMN + " (was: " + header + ")"));
        }

        List<HourlyRecord> records = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        String line;
        int lineNumber = 1;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) continue;

            String[] fields = line.split(",", -1);
            try {
                LocalDateTime timestamp = parseTimestamp(fields[0]);
                double load = Double.parseDouble(fields[loadIndex].trim());
                double solar = Double.parseDouble(fields[solarIndex].trim());
                Double temperature = temperatureIndex >= 0 && temperatureIndex < fields.length
                        && !fields[temperatureIndex].isBlank()
                        ? Double.valueOf(fields[temperatureIndex].trim())
                        : null;
                records.add(new HourlyRecord(timestamp, load, solar, temperature));
            } catch (ArrayIndexOutOfBoundsException | NumberFormatException | DateTimeParseException e) {
                errors.add(String.format("line %d: %s (%s)", lineNumber, line, e.getMessage()));
            }
        }

        if (!errors.isEmpty()) {
            logger.warn("{} malformed CSV rows", errors.size());
            throw new DispatchConfigurationException(errors);
        }
        return records;
    }

    /**
     * One horizon over all records, solar scaled by the given nameplate.
     */
    public HorizonInput toHorizon(List<HourlyRecord> records, double solarCapacityKW) {
        double[] load = new double[records.size()];
        double[] solarPerUnit = new double[records.size()];
        for (int i = 0; i < records.size(); i++) {
            load[i] = records.get(i).getLoadKW();
            solarPerUnit[i] = records.get(i).getSolarPerUnit();
        }
        return HorizonInput.fromPerUnitSolar(load, solarPerUnit, solarCapacityKW);
    }

    /**
     * One horizon per calendar month, in order of first appearance.
     */
    public Map<YearMonth, HorizonInput> splitByMonth(List<HourlyRecord> records, double solarCapacityKW) {
        Map<YearMonth, List<HourlyRecord>> byMonth = new LinkedHashMap<>();
        for (HourlyRecord record : records) {
            byMonth.computeIfAbsent(YearMonth.from(record.getTimestamp()), month -> new ArrayList<>()).add(record);
        }

        Map<YearMonth, HorizonInput> horizons = new LinkedHashMap<>();
        byMonth.forEach((month, monthRecords) -> horizons.put(month, toHorizon(monthRecords, solarCapacityKW)));
        return horizons;
    }

    private static LocalDateTime parseTimestamp(String raw) {
        return LocalDateTime.parse(raw.trim().replace(' ', 'T'));
    }
}
