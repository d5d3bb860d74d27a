/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.calcite.eda.table;

import org.apache.calcite.eda.error.CsvParseException;
import org.apache.calcite.eda.error.DatasetNotFoundException;
import org.apache.calcite.eda.path.DatasetReference;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses a CSV file into a {@link Table}, inferring a type per column.
 *
 * <p>The first non-blank record is the header. Every call reads the file
 * again; nothing is cached between calls.
 */
public class TableLoader {
  private static final Logger logger = LoggerFactory.getLogger(TableLoader.class);

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  /**
   * Loads a table.
   *
   * @param dataset Resolved dataset
   * @return freshly parsed table
   * @throws CsvParseException if the file is empty, malformed, or has empty or
   *     duplicate header names
   * @throws DatasetNotFoundException if the file disappeared after resolution
   */
  public Table load(DatasetReference dataset)
      throws CsvParseException, DatasetNotFoundException {
    String name = dataset.getRelativePath();
    try (LineTrackingReader lines = new LineTrackingReader(
             Files.newBufferedReader(dataset.getAbsolutePath(), StandardCharsets.UTF_8));
         CSVReader reader = openCsv(lines, dataset.getAbsolutePath())) {
      String[] header = readNonBlank(reader, lines);
      if (header == null) {
        throw new CsvParseException("CSV file is empty (no header row): " + name);
      }
      List<String> columnNames = validateHeader(header, name);

      List<List<@Nullable String>> cells = new ArrayList<>(columnNames.size());
      for (int i = 0; i < columnNames.size(); i++) {
        cells.add(new ArrayList<>());
      }

      int rowCount = 0;
      String[] record;
      while ((record = readNonBlank(reader, lines)) != null) {
        if (record.length != columnNames.size()) {
          throw new CsvParseException(
              String.format(Locale.ROOT, "Expected %d fields but found %d at line %d of %s",
                  columnNames.size(), record.length, reader.getLinesRead(), name));
        }
        for (int i = 0; i < record.length; i++) {
          cells.get(i).add(record[i]);
        }
        rowCount++;
      }

      List<Column> columns = new ArrayList<>(columnNames.size());
      for (int i = 0; i < columnNames.size(); i++) {
        List<@Nullable String> raw = cells.get(i);
        ColumnType type = ColumnTypeInferrer.infer(raw);
        columns.add(new Column(columnNames.get(i), type, ColumnTypeInferrer.convert(type, raw)));
      }

      logger.debug("Loaded {}: {} rows, {} columns", name, rowCount, columns.size());
      return new Table(columns, rowCount);

    } catch (CsvMalformedLineException e) {
      throw new CsvParseException("Malformed CSV near line " + e.getLineNumber()
          + " of " + name + ": " + e.getMessage(), e);
    } catch (CsvValidationException e) {
      throw new CsvParseException("Invalid CSV line " + e.getLineNumber()
          + " of " + name + ": " + e.getMessage(), e);
    } catch (NoSuchFileException e) {
      throw new DatasetNotFoundException("CSV file not found: " + name, e);
    } catch (IOException e) {
      throw new CsvParseException("Failed to read " + name + ": " + e.getMessage(), e);
    }
  }

  /**
   * Opens a CSV reader, handling TSV files.
   */
  private static CSVReader openCsv(BufferedReader lines, Path path) {
    char separator = path.toString().toLowerCase(Locale.ROOT).endsWith(".tsv") ? '\t' : ',';
    return new CSVReaderBuilder(lines)
        .withCSVParser(new RFC4180ParserBuilder().withSeparator(separator).build())
        .build();
  }

  /**
   * Reads the next record, skipping empty lines.
   *
   * <p>A single empty field is also what a quoted empty cell ({@code ""})
   * parses to, so a record is only skipped when it came from one physical
   * line of no characters.
   */
  private static String @Nullable [] readNonBlank(CSVReader reader, LineTrackingReader lines)
      throws IOException, CsvValidationException {
    String[] record;
    boolean blank;
    do {
      long linesBefore = reader.getLinesRead();
      record = reader.readNext();
      blank = record != null
          && record.length == 1
          && record[0].isEmpty()
          && reader.getLinesRead() - linesBefore == 1
          && lines.isLastLineEmpty();
    } while (blank);
    return record;
  }

  private static List<String> validateHeader(String[] header, String name)
      throws CsvParseException {
    if (header.length > 0 && !header[0].isEmpty() && header[0].charAt(0) == BYTE_ORDER_MARK) {
      header[0] = header[0].substring(1);
    }
    List<String> names = new ArrayList<>(header.length);
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < header.length; i++) {
      String column = header[i];
      if (column.trim().isEmpty()) {
        throw new CsvParseException("Empty column name at position " + (i + 1) + " in " + name);
      }
      if (!seen.add(column)) {
        throw new CsvParseException("Duplicate column name '" + column + "' in " + name);
      }
      names.add(column);
    }
    return names;
  }

  /** Remembers whether the most recently read physical line was empty. */
  private static class LineTrackingReader extends BufferedReader {
    private boolean lastLineEmpty;

    LineTrackingReader(Reader in) {
      super(in);
    }

    @Override public @Nullable String readLine() throws IOException {
      String line = super.readLine();
      lastLineEmpty = line != null && line.isEmpty();
      return line;
    }

    boolean isLastLineEmpty() {
      return lastLineEmpty;
    }
  }
}
