/*
 * AbstractPureMap.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;
import java.util.*;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * This class provides a skeletal implementation of the PureMap interface.
 * It exists to provide methods for all the mutating operations which throw
 * <code>UnsupportedOperationException</code> (including the ones
 * <code>Map</code> declares as default methods, which would otherwise reach
 * <code>put</code> only some of the time), and to provide a method for
 * <code>clone</code> which simply returns <code>this</code>.
 *
 * <p>It also supplies <code>getAndUpdate</code>, which can be written in terms
 * of <code>get</code>, <code>with</code> and <code>pop</code>.
 *
 * @author Scott L. Burson
 */

public abstract class AbstractPureMap<Key, Val>
    extends AbstractMap<Key, Val>
    implements PureMap<Key, Val>
{

    public <R> Result<R, Key, Val> getAndUpdate(Key key, Updater<Val, R> updater) {
	Change<R, Val> change = updater.update(get(key));
	if (change == null) throw new NullPointerException("updater returned null for key " + key);
	else if (change.isPop()) {
	    // Only a Change<Val, Val> can pop, so R is Val here.
	    Result<Val, Key, Val> popped = pop(key);
	    return new Result<R, Key, Val>((R)(Object)popped.getValue(), popped.getMap());
	} else return new Result<R, Key, Val>(change.getReturnValue(),
					      with(key, change.getNewValue()));
    }

    /**
     * Unsupported.
     */
    public final void clear() {
	throw new UnsupportedOperationException();
    }

    /**
     * Returns this map.
     */
    public final AbstractPureMap<Key, Val> clone() {
	return this;
    }

    /**
     * Unsupported.
     */
    public final Val put(Key key, Val value) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final void putAll(Map<? extends Key, ? extends Val> m) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final Val remove(Object key) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final boolean remove(Object key, Object value) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported; see {@link #withIfAbsent}.
     */
    public final Val putIfAbsent(Key key, Val value) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final Val replace(Key key, Val value) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final boolean replace(Key key, Val oldValue, Val newValue) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final void replaceAll(BiFunction<? super Key, ? super Val, ? extends Val> function) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final Val computeIfAbsent(Key key, Function<? super Key, ? extends Val> mappingFunction) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final Val computeIfPresent(Key key,
				      BiFunction<? super Key, ? super Val, ? extends Val> remappingFunction) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported; see {@link #getAndUpdate}.
     */
    public final Val compute(Key key,
			     BiFunction<? super Key, ? super Val, ? extends Val> remappingFunction) {
	throw new UnsupportedOperationException();
    }

    /**
     * Unsupported.
     */
    public final Val merge(Key key, Val value,
			   BiFunction<? super Val, ? super Val, ? extends Val> remappingFunction) {
	throw new UnsupportedOperationException();
    }

}
