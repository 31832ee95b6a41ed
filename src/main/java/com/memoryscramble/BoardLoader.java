package com.memoryscramble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads boards from the board file format.
 *
 * File format:
 * ```
 * 3x3
 * 🦄
 * 🦄
 * 🌈
 * ...
 * ```
 * The first line is ROWSxCOLS; then exactly ROWS*COLS card lines follow, in
 * row-major order (row 0 left to right, then row 1, ...). A card is any
 * non-empty text without whitespace.
 */
public final class BoardLoader {
    private static final Logger LOG = LoggerFactory.getLogger(BoardLoader.class);

    private static final Pattern SIZE_LINE = Pattern.compile("^(\\d+)x(\\d+)$");
    private static final Pattern CARD = Pattern.compile("^\\S+$");

    private BoardLoader() {
    }

    /**
     * Loads a board from a file.
     *
     * @param file path to the board file
     * @param settings settings for the new board
     * @return a new Board with every card face-down
     * @throws BoardFormatException if the file does not follow the format
     * @throws IOException if the file cannot be read
     */
    public static Board loadFromFile(Path file, BoardSettings settings) throws IOException {
        Board board = parse(Files.readString(file, StandardCharsets.UTF_8), settings);
        LOG.info("Loaded {}x{} board from {}", board.getRows(), board.getColumns(), file);
        return board;
    }

    /**
     * Loads a board from a file using the configured settings.
     */
    public static Board loadFromFile(Path file) throws IOException {
        return loadFromFile(file, BoardSettings.load());
    }

    /**
     * Loads a board from a classpath resource, e.g. {@code boards/perfect.txt}.
     *
     * @throws IOException if the resource is missing, unreadable or malformed
     */
    public static Board loadFromResource(String resource, BoardSettings settings) throws IOException {
        try (InputStream in = BoardLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("No board resource " + resource);
            }
            Board board = parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), settings);
            LOG.info("Loaded {}x{} board from resource {}", board.getRows(), board.getColumns(), resource);
            return board;
        }
    }

    /**
     * Parses the text of a board file.
     *
     * @throws BoardFormatException on a malformed size line, a wrong number of
     *         card lines, or a blank or whitespace-containing card
     */
    public static Board parse(String text, BoardSettings settings) throws BoardFormatException {
        String[] lines = text.strip().split("\\r?\\n");
        if (lines.length < 2) {
            throw new BoardFormatException("Board file must have a size line and at least one card");
        }

        Matcher size = SIZE_LINE.matcher(lines[0].strip());
        if (!size.matches()) {
            throw new BoardFormatException("Invalid board size line: " + lines[0]);
        }
        int rows;
        int cols;
        try {
            rows = Integer.parseInt(size.group(1));
            cols = Integer.parseInt(size.group(2));
        } catch (NumberFormatException e) {
            throw new BoardFormatException("Board size too large: " + lines[0]);
        }
        if (rows <= 0 || cols <= 0) {
            throw new BoardFormatException("Board dimensions must be positive: " + lines[0]);
        }

        int cardLines = lines.length - 1;
        if ((long) rows * cols != cardLines) {
            throw new BoardFormatException(
                    "Expected " + ((long) rows * cols) + " cards for " + rows + "x" + cols + " but found " + cardLines);
        }

        List<String> cards = new ArrayList<>(cardLines);
        for (int i = 1; i < lines.length; i++) {
            String card = lines[i].strip();
            int index = i - 1;
            if (card.isEmpty()) {
                throw new BoardFormatException("Empty card at position " + index / cols + "," + index % cols);
            }
            if (!CARD.matcher(card).matches()) {
                throw new BoardFormatException("Card contains whitespace at position " + index / cols + "," + index % cols);
            }
            cards.add(card);
        }
        return new Board(rows, cols, cards, settings);
    }
}
