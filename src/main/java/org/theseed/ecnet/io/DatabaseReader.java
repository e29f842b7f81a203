/**
 *
 */
package org.theseed.ecnet.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.text.StringTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.ecnet.data.DataRow;
import org.theseed.ecnet.data.Dataset;

/**
 * This class reads a database file into a dataset.  The file is comma-separated, and fields may be quoted.  The
 * first line contains a type for each column, and the second line contains the column titles.  Each remaining
 * line is one sample.  The column types are
 *
 * DATAID		the sample ID (exactly one column must have this type)
 * ASSIGNMENT	the partition assignment-- L (learn), V (validation), or T (test)
 * STRING		descriptive text, ignored
 * TARGET		an output column
 * INPUT		an input column
 *
 * Any other type is ignored.  An empty numeric field is read as 0.
 *
 * @author Bruce Parrello
 *
 */
public class DatabaseReader {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(DatabaseReader.class);

    /** column types */
    private static enum ColumnType {
        DATAID, ASSIGNMENT, STRING, TARGET, INPUT, OTHER;

        /**
         * @return the column type for a type-row string
         *
         * @param string	type string from the file
         */
        static ColumnType parse(String string) {
            ColumnType retVal = OTHER;
            String value = StringUtils.trimToEmpty(string).toUpperCase();
            for (ColumnType type : ColumnType.values()) {
                if (type.name().equals(value))
                    retVal = type;
            }
            return retVal;
        }
    }

    /**
     * Read a database file.
     *
     * @param inFile	file to read
     *
     * @return a dataset containing the samples in the file
     *
     * @throws IOException
     */
    public static Dataset read(File inFile) throws IOException {
        log.info("Reading database from {}.", inFile);
        try (BufferedReader reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * Read a database from a stream.
     *
     * @param inStream	reader for the database text
     *
     * @return a dataset containing the samples in the stream
     *
     * @throws IOException
     */
    public static Dataset read(Reader inStream) throws IOException {
        BufferedReader reader = (inStream instanceof BufferedReader ? (BufferedReader) inStream
                : new BufferedReader(inStream));
        String typeLine = reader.readLine();
        String titleLine = reader.readLine();
        if (typeLine == null || titleLine == null)
            throw new IOException("Database is missing its type and title lines.");
        String[] typeStrings = splitLine(typeLine);
        String[] titles = splitLine(titleLine);
        final int width = typeStrings.length;
        if (titles.length != width)
            throw new IOException(String.format("Database has %d column types but %d column titles.", width, titles.length));
        // Sort out the columns.
        ColumnType[] types = new ColumnType[width];
        int idCol = -1;
        int assignCol = -1;
        List<Integer> inCols = new ArrayList<Integer>();
        List<Integer> outCols = new ArrayList<Integer>();
        List<String> inputNames = new ArrayList<String>();
        List<String> outputNames = new ArrayList<String>();
        for (int i = 0; i < width; i++) {
            types[i] = ColumnType.parse(typeStrings[i]);
            switch (types[i]) {
            case DATAID :
                if (idCol >= 0)
                    throw new IOException("Database has more than one DATAID column.");
                idCol = i;
                break;
            case ASSIGNMENT :
                assignCol = i;
                break;
            case TARGET :
                outCols.add(i);
                outputNames.add(titles[i]);
                break;
            case INPUT :
                inCols.add(i);
                inputNames.add(titles[i]);
                break;
            case OTHER :
                log.warn("Column \"{}\" has unknown type \"{}\" and will be ignored.", titles[i], typeStrings[i]);
                break;
            case STRING :
                break;
            }
        }
        if (idCol < 0)
            throw new IOException("Database has no DATAID column.");
        // Read the samples.
        List<DataRow> rows = new ArrayList<DataRow>();
        int lineNum = 2;
        for (String line = reader.readLine(); line != null; line = reader.readLine()) {
            lineNum++;
            if (! StringUtils.isBlank(line)) {
                String[] fields = splitLine(line);
                if (fields.length != width)
                    throw new IOException(String.format("Line %d has %d fields instead of %d.", lineNum, fields.length, width));
                double[] inputs = parseValues(fields, inCols, lineNum);
                double[] outputs = parseValues(fields, outCols, lineNum);
                String assignment = (assignCol >= 0 ? fields[assignCol] : null);
                rows.add(new DataRow(fields[idCol], inputs, outputs, assignment));
            }
        }
        log.info("{} samples read with {} inputs and {} targets.", rows.size(), inputNames.size(), outputNames.size());
        return new Dataset(inputNames, outputNames, rows);
    }

    /**
     * @return the fields in a comma-separated line, with quotes removed
     *
     * @param line	line to split
     */
    private static String[] splitLine(String line) {
        return StringTokenizer.getCSVInstance(line).getTokenArray();
    }

    /**
     * Extract the numeric values from a line.
     *
     * @param fields	fields of the line
     * @param cols		indices of the numeric columns to extract
     * @param lineNum	line number, for error messages
     *
     * @return the values in the specified columns
     *
     * @throws IOException if a value is not numeric
     */
    private static double[] parseValues(String[] fields, List<Integer> cols, int lineNum) throws IOException {
        double[] retVal = new double[cols.size()];
        for (int i = 0; i < retVal.length; i++) {
            String field = StringUtils.trimToEmpty(fields[cols.get(i)]);
            if (field.isEmpty())
                retVal[i] = 0.0;
            else try {
                retVal[i] = Double.parseDouble(field);
            } catch (NumberFormatException e) {
                throw new IOException(String.format("Invalid number \"%s\" in line %d.", field, lineNum), e);
            }
        }
        return retVal;
    }

}
