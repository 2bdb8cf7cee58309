package com.example.subtitlecodec.tags;

import com.example.subtitlecodec.exception.UnterminatedOverrideBlockException;
import com.example.subtitlecodec.model.StyleOverride;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Single forward scan over event text producing {@link OverrideRun}s on demand.
 * <p>
 * States: OUTSIDE_TAG collects literal text, INSIDE_TAG collects brace comments,
 * IN_DIRECTIVE collects one backslash directive. A backslash inside parentheses
 * (as in {@code \t(0,500,\fs30)}) stays part of the enclosing directive. Block content is
 * only committed when its closing brace is seen.
 */
final class OverrideTagScanner implements Iterator<OverrideRun> {

    private enum State {
        OUTSIDE_TAG,
        INSIDE_TAG,
        IN_DIRECTIVE
    }

    private final String text;
    private final boolean lenient;
    private final Deque<OverrideRun> ready = new ArrayDeque<>();
    private int pos;
    private StyleOverride pending = StyleOverride.empty();
    private boolean finished;

    OverrideTagScanner(String text, boolean lenient) {
        this.text = text;
        this.lenient = lenient;
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !finished) {
            step();
        }
        return !ready.isEmpty();
    }

    @Override
    public OverrideRun next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    private void step() {
        int length = text.length();
        if (pos >= length) {
            if (!pending.isEmpty()) {
                emitText("");
            }
            finished = true;
            return;
        }

        State state = State.OUTSIDE_TAG;
        StringBuilder literal = new StringBuilder();
        StringBuilder piece = new StringBuilder();
        List<String> pieces = new ArrayList<>();
        int blockStart = -1;
        int parenDepth = 0;

        for (int i = pos; i < length; i++) {
            char c = text.charAt(i);
            switch (state) {
                case OUTSIDE_TAG -> {
                    if (c == '{') {
                        if (literal.length() > 0) {
                            emitText(literal.toString());
                            pos = i;
                            return;
                        }
                        blockStart = i;
                        state = State.INSIDE_TAG;
                    } else {
                        literal.append(c);
                    }
                }
                case INSIDE_TAG, IN_DIRECTIVE -> {
                    if (c == '}') {
                        addPiece(pieces, piece);
                        commitBlock(pieces);
                        pos = i + 1;
                        return;
                    }
                    if (c == '\\' && parenDepth == 0) {
                        addPiece(pieces, piece);
                        state = State.IN_DIRECTIVE;
                    } else if (state == State.IN_DIRECTIVE && c == '(') {
                        parenDepth++;
                    } else if (state == State.IN_DIRECTIVE && c == ')' && parenDepth > 0) {
                        parenDepth--;
                    }
                    piece.append(c);
                }
            }
        }

        if (state == State.OUTSIDE_TAG) {
            emitText(literal.toString());
            pos = length;
            return;
        }
        if (!lenient) {
            throw new UnterminatedOverrideBlockException(blockStart);
        }
        // orphan '{': everything after it is literal text
        emitText(text.substring(blockStart));
        pos = length;
    }

    private static void addPiece(List<String> pieces, StringBuilder piece) {
        if (piece.length() > 0) {
            pieces.add(piece.toString());
            piece.setLength(0);
        }
    }

    private void commitBlock(List<String> pieces) {
        for (String piece : pieces) {
            if (piece.startsWith("\\")) {
                StyleOverride delta = OverrideDirectives.parse(piece.substring(1));
                if (delta != null) {
                    pending = pending.then(delta);
                    continue;
                }
            }
            ready.add(OverrideRun.passthrough(piece));
        }
    }

    private void emitText(String literal) {
        ready.add(OverrideRun.text(pending, literal));
        pending = StyleOverride.empty();
    }
}
