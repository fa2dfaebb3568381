package com.lessj.compiler.ast.rule;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 不可变的帧链（由内向外），闭包捕获后不会再被修改
 */
public final class FrameChain implements Iterable<Frame> {
    public static final FrameChain EMPTY = new FrameChain(null, null, 0);

    private final Frame head;
    private final FrameChain tail;
    private final int size;

    private FrameChain(Frame head, FrameChain tail, int size) {
        this.head = head;
        this.tail = tail;
        this.size = size;
    }

    public static FrameChain of(List<? extends Frame> frames) {
        FrameChain chain = EMPTY;
        for (int i = frames.size() - 1; i >= 0; i--) {
            chain = chain.push(frames.get(i));
        }
        return chain;
    }

    /** 在最内层压入新帧 */
    public FrameChain push(Frame frame) {
        return new FrameChain(frame, this, size + 1);
    }

    /**
     * 本链在内、outer 在外拼接
     */
    public FrameChain concat(FrameChain outer) {
        if (isEmpty()) {
            return outer;
        }
        if (outer.isEmpty()) {
            return this;
        }
        List<Frame> mine = toList();
        FrameChain result = outer;
        for (int i = mine.size() - 1; i >= 0; i--) {
            result = result.push(mine.get(i));
        }
        return result;
    }

    public Frame first() {
        if (head == null) {
            throw new NoSuchElementException("empty frame chain");
        }
        return head;
    }

    public FrameChain rest() {
        return tail == null ? EMPTY : tail;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    public boolean contains(Frame frame) {
        for (Frame f : this) {
            if (f == frame) {
                return true;
            }
        }
        return false;
    }

    public List<Frame> toList() {
        List<Frame> list = new ArrayList<>(size);
        for (Frame f : this) {
            list.add(f);
        }
        return list;
    }

    @Override
    public Iterator<Frame> iterator() {
        return new Iterator<Frame>() {
            private FrameChain current = FrameChain.this;

            @Override
            public boolean hasNext() {
                return current.size > 0;
            }

            @Override
            public Frame next() {
                if (current.size == 0) {
                    throw new NoSuchElementException();
                }
                Frame f = current.head;
                current = current.tail;
                return f;
            }
        };
    }
}
