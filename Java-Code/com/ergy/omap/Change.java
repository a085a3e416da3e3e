/*
 * Change.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * What an {@link Updater} asks {@link PureMap#getAndUpdate} to do: either store a
 * new value, handing back some other value to the caller, or remove the key.
 *
 * @author Scott L. Burson
 */

public final class Change<R, Val> {

    private static final Change POP = new Change(true, null, null);

    private Change(boolean _pop, R _returnValue, Val _newValue) {
	pop = _pop;
	returnValue = _returnValue;
	newValue = _newValue;
    }

    private final boolean pop;
    private final R returnValue;
    private final Val newValue;

    /**
     * Stores <code>newValue</code> under the key and returns
     * <code>returnValue</code>.
     */
    public static <R, Val> Change<R, Val> replace(R returnValue, Val newValue) {
	return new Change<R, Val>(false, returnValue, newValue);
    }

    /**
     * Removes the key and returns its former value.  Only an updater whose
     * return type is the value type can ask for this.
     */
    public static <Val> Change<Val, Val> pop() {
	return (Change<Val, Val>)POP;
    }

    public boolean isPop() {
	return pop;
    }

    public R getReturnValue() {
	return returnValue;
    }

    public Val getNewValue() {
	return newValue;
    }

    public String toString() {
	return pop ? "Change.pop" : "Change.replace(" + returnValue + ", " + newValue + ")";
    }

}
