package com.rift.lexer;

import com.rift.exception.AllocationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Ordered, append-only sequence of tokens in source order.
 * Storage doubles when full and never shrinks.
 */
public final class TokenStream implements Iterable<Token> {

    public static final int DEFAULT_CAPACITY = 10;

    // Largest array most VMs will allocate
    private static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private Token[] tokens;
    private int count;

    public TokenStream() {
        this(DEFAULT_CAPACITY);
    }

    public TokenStream(int initialCapacity) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive");
        }
        this.tokens = new Token[initialCapacity];
        this.count = 0;
    }

    /**
     * Append a token, growing storage if needed.
     *
     * @throws AllocationException if the stream is already at maximum capacity
     */
    public void append(Token token) {
        if (token == null) {
            throw new IllegalArgumentException("Token cannot be null");
        }
        if (count == tokens.length) {
            grow();
        }
        tokens[count++] = token;
    }

    public Token get(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("Index " + index + " out of bounds for size " + count);
        }
        return tokens[index];
    }

    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    public int capacity() {
        return tokens.length;
    }

    public List<Token> toList() {
        return List.copyOf(Arrays.asList(tokens).subList(0, count));
    }

    @Override
    public Iterator<Token> iterator() {
        return new Iterator<>() {
            private int next = 0;

            @Override
            public boolean hasNext() {
                return next < count;
            }

            @Override
            public Token next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return tokens[next++];
            }
        };
    }

    private void grow() {
        if (tokens.length >= MAX_CAPACITY) {
            throw new AllocationException("Token stream cannot grow beyond " + MAX_CAPACITY + " tokens");
        }
        int newCapacity = tokens.length > MAX_CAPACITY / 2 ? MAX_CAPACITY : tokens.length * 2;
        tokens = Arrays.copyOf(tokens, newCapacity);
    }

    @Override
    public String toString() {
        List<Token> view = new ArrayList<>(count);
        for (Token token : this) {
            view.add(token);
        }
        return "TokenStream" + view;
    }
}
