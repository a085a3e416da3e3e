/*
 * Step.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * A control signal in a reduction (see {@link PureLinkedHashMap#reduce}), carrying
 * the accumulator.  <code>cont</code> proceeds to the next entry; <code>halt</code>
 * stops at once; <code>suspend</code> pauses, handing the caller a {@link
 * Reduction} that can be resumed later from the next unvisited entry.
 *
 * @author Scott L. Burson
 */

public final class Step<Acc> {

    public enum Kind { CONTINUE, HALT, SUSPEND }

    private Step(Kind _kind, Acc _acc) {
	kind = _kind;
	acc = _acc;
    }

    private final Kind kind;
    private final Acc acc;

    public static <Acc> Step<Acc> cont(Acc acc) {
	return new Step<Acc>(Kind.CONTINUE, acc);
    }

    public static <Acc> Step<Acc> halt(Acc acc) {
	return new Step<Acc>(Kind.HALT, acc);
    }

    public static <Acc> Step<Acc> suspend(Acc acc) {
	return new Step<Acc>(Kind.SUSPEND, acc);
    }

    public Kind getKind() {
	return kind;
    }

    public Acc getAccumulator() {
	return acc;
    }

    public String toString() {
	return kind + "(" + acc + ")";
    }

}
