/*
 * Reduction.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * The outcome of {@link PureLinkedHashMap#reduce}.  A reduction is
 * <code>DONE</code> when every entry was visited, <code>HALTED</code> when the
 * reducer asked to stop, and <code>SUSPENDED</code> when the reducer asked to
 * pause; only a suspended reduction can be resumed.
 *
 * <p>A suspended reduction remembers its position but nothing else that can
 * change, so resuming it twice with the same signal gives the same outcome.
 *
 * @author Scott L. Burson
 */

public final class Reduction<Acc> {

    public enum Status { DONE, HALTED, SUSPENDED }

    Reduction(Status _status, Acc _acc, PureLinkedHashMap.Traversal<?, ?, Acc> _rest) {
	status = _status;
	acc = _acc;
	rest = _rest;
    }

    private final Status status;
    private final Acc acc;
    private final PureLinkedHashMap.Traversal<?, ?, Acc> rest;	// null unless suspended

    public Status getStatus() {
	return status;
    }

    public boolean isDone() {
	return status == Status.DONE;
    }

    public boolean isHalted() {
	return status == Status.HALTED;
    }

    public boolean isSuspended() {
	return status == Status.SUSPENDED;
    }

    public Acc getAccumulator() {
	return acc;
    }

    /**
     * Resumes a suspended reduction with its own accumulator.
     *
     * @throws IllegalStateException if this reduction is not suspended
     */
    public Reduction<Acc> resume() {
	return resume(Step.cont(acc));
    }

    /**
     * Resumes a suspended reduction with <code>signal</code>, exactly as if the
     * reducer had returned it.
     *
     * @throws IllegalStateException if this reduction is not suspended
     */
    public Reduction<Acc> resume(Step<Acc> signal) {
	if (signal == null) throw new NullPointerException("resume step is null");
	if (rest == null) throw new IllegalStateException("reduction is " + status + ", not suspended");
	return rest.run(signal);
    }

    public String toString() {
	return status + "(" + acc + ")";
    }

}
