package com.sc2.replay.attribute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.sc2.replay.model.Attribute;

/**
 * The decoded attributes of one replay, in record order.
 */
public class AttributeSet implements Iterable<Attribute> {

    private final List<Attribute> attributes;

    public AttributeSet(List<Attribute> attributes) {
        this.attributes = List.copyOf(attributes);
    }

    public static AttributeSet empty() {
        return new AttributeSet(List.of());
    }

    public List<Attribute> asList() {
        return attributes;
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    @Override
    public Iterator<Attribute> iterator() {
        return attributes.iterator();
    }

    /**
     * Attributes grouped by owner index, owners ascending, record order kept within a group.
     */
    public Map<Integer, List<Attribute>> groupByOwner() {
        Map<Integer, List<Attribute>> groups = new TreeMap<>();
        for (Attribute attribute : attributes) {
            groups.computeIfAbsent(attribute.getOwnerIndex(), k -> new ArrayList<>()).add(attribute);
        }
        Map<Integer, List<Attribute>> result = new LinkedHashMap<>();
        groups.forEach((owner, list) -> result.put(owner, Collections.unmodifiableList(list)));
        return Collections.unmodifiableMap(result);
    }

    public List<Attribute> forOwner(int ownerIndex) {
        return attributes.stream()
                .filter(a -> a.getOwnerIndex() == ownerIndex)
                .toList();
    }

    public Optional<Attribute> find(int ownerIndex, AttributeCode code) {
        return attributes.stream()
                .filter(a -> a.getOwnerIndex() == ownerIndex && a.getCode() == code.getCode())
                .findFirst();
    }

    public Optional<Attribute> find(int ownerIndex, String displayName) {
        return attributes.stream()
                .filter(a -> a.getOwnerIndex() == ownerIndex && a.getDisplayName().equals(displayName))
                .findFirst();
    }
}
