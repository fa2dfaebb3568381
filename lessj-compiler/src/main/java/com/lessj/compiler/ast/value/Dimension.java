package com.lessj.compiler.ast.value;

import com.lessj.compiler.ast.FileInfo;
import com.lessj.compiler.ast.Node;
import com.lessj.compiler.ast.NodeVisitor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 带单位的数值，如 10px、50%、1.5
 */
public final class Dimension extends Node {
    private final double value;
    private final Unit unit;

    public Dimension(double value) {
        this(value, Unit.EMPTY);
    }

    public Dimension(double value, String unit) {
        this(value, Unit.of(unit));
    }

    public Dimension(double value, Unit unit) {
        this(value, unit, 0, null);
    }

    public Dimension(double value, Unit unit, int index, FileInfo fileInfo) {
        super(index, fileInfo);
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Dimension is not a number.");
        }
        this.value = value;
        this.unit = unit == null ? Unit.EMPTY : unit;
    }

    public double getValue() {
        return value;
    }

    public Unit getUnit() {
        return unit;
    }

    public Color toColor() {
        return new Color(new double[]{value, value, value}, 1, null);
    }

    /**
     * 换算到指定单位（如 "px"），单位不在任何换算组中时原样返回
     */
    public Dimension convertTo(String targetUnit) {
        Map<String, String> conversions = new LinkedHashMap<>();
        for (Map.Entry<String, Map<String, Double>> group : Unit.CONVERSIONS.entrySet()) {
            if (group.getValue().containsKey(targetUnit)) {
                conversions.put(group.getKey(), targetUnit);
            }
        }
        return convertTo(conversions);
    }

    /**
     * 按"组名 -> 目标单位"逐组换算
     */
    public Dimension convertTo(Map<String, String> conversions) {
        double[] result = {value};
        Unit converted = unit;
        for (Map.Entry<String, String> entry : conversions.entrySet()) {
            final String targetUnit = entry.getValue();
            final Map<String, Double> group = Unit.CONVERSIONS.get(entry.getKey());
            converted = converted.map((atomicUnit, denominator) -> {
                Double factor = group.get(atomicUnit);
                if (factor == null) {
                    return atomicUnit;
                }
                double ratio = factor / group.get(targetUnit);
                if (denominator) {
                    result[0] = result[0] / ratio;
                } else {
                    result[0] = result[0] * ratio;
                }
                return targetUnit;
            });
        }
        return new Dimension(result[0], converted.cancel());
    }

    /** 统一到 px / s / rad 以便比较 */
    public Dimension unify() {
        Map<String, String> base = new LinkedHashMap<>();
        base.put("length", "px");
        base.put("duration", "s");
        base.put("angle", "rad");
        return convertTo(Collections.unmodifiableMap(base));
    }

    /**
     * 比较两个数值；单位不可比时返回 null
     */
    public Integer compareTo(Dimension other) {
        Dimension a = this;
        Dimension b = other;
        if (!unit.isEmpty() && !other.unit.isEmpty()) {
            a = unify();
            b = other.unify();
            if (!a.unit.is(b.unit.toString())) {
                return null;
            }
        }
        return Double.compare(a.value, b.value) < 0 ? -1 : (a.value == b.value ? 0 : 1);
    }

    @Override
    public <R, C> R accept(NodeVisitor<R, C> visitor, C context) {
        return visitor.visitDimension(this, context);
    }

    @Override
    public String toString() {
        return value + unit.toString();
    }
}
