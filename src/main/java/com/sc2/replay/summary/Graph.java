package com.sc2.replay.summary;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import com.sc2.replay.exception.LengthMismatchException;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * A time series from the score screen, such as army value or income over time.
 * Times are not required to be ordered.
 */
@Getter
@EqualsAndHashCode
public class Graph {

    private final List<Long> times;
    private final List<Long> values;

    public Graph(@NonNull List<Long> times, @NonNull List<Long> values) {
        if (times.size() != values.size()) {
            throw new LengthMismatchException(times.size(), values.size());
        }
        this.times = List.copyOf(times);
        this.values = List.copyOf(values);
    }

    /**
     * Build a graph by unzipping (time, value) points.
     */
    public static Graph fromPoints(@NonNull List<GraphPoint> points) {
        List<Long> times = new ArrayList<>(points.size());
        List<Long> values = new ArrayList<>(points.size());
        for (GraphPoint point : points) {
            times.add(point.getTime());
            values.add(point.getValue());
        }
        return new Graph(times, values);
    }

    public int size() {
        return Math.min(times.size(), values.size());
    }

    /**
     * The graph as (time, value) points. Each call to {@code iterator()} starts over.
     */
    public Iterable<GraphPoint> asPoints() {
        return () -> new Iterator<>() {
            private int index;

            @Override
            public boolean hasNext() {
                return index < size();
            }

            @Override
            public GraphPoint next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                GraphPoint point = new GraphPoint(times.get(index), values.get(index));
                index++;
                return point;
            }
        };
    }

    @Override
    public String toString() {
        return "Graph with " + times.size() + " values";
    }
}
