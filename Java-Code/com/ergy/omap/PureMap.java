/*
 * PureMap.java
 *
 * Copyright (c) 2013 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL).
 */


package com.ergy.omap;
import java.util.*;

/**
 * A map for which the update operators are all pure (functional): they return a
 * new map rather than modifying the existing one.
 *
 * <p>Although this interface extends {@link Map} of the Java Collections Framework,
 * and thus is somewhat integrated into that framework, it is not used the same way
 * as the <code>java.util</code> classes that implement <code>Map</code>.  It does
 * not support the update operators declared by <code>Map</code> (which are
 * documented as optional, anyway); in their place it adds several new operators
 * which are "pure", in the sense that rather than modifying the map in place, they
 * construct and return a new map.
 *
 * <p>Presence of a key is a property of the key alone.  A key mapped to
 * <code>null</code>, <code>Boolean.FALSE</code>, zero or the empty string is as
 * present as any other; use {@link #containsKey} or {@link #fetch} to ask, since
 * <code>get</code> cannot tell a stored <code>null</code> from a missing key.
 *
 * <p>Classes implementing <code>PureMap</code> may also provide, corresponding to
 * each constructor, a static factory method <code>withDefault</code> which, in
 * addition to the functionality of the constructor, also allows the specification
 * of a default value to be returned by the <code>get</code> method when it is
 * called with a key which is not in the map.  (Otherwise, <code>get</code> returns
 * <code>null</code> in that case.)
 *
 * @author Scott L. Burson.
 */

public interface PureMap<Key, Val>
    extends Map<Key, Val>, Iterable<Map.Entry<Key, Val>>
{

    /**
     * Returns an arbitrary pair of the map as a {@link java.util.Map.Entry}, or
     * null if the map is empty.  <i>All</i> this guarantees is that if the map is
     * nonempty, the returned pair will be in the map; no other assumptions should
     * be made.
     *
     * @return some pair of the map, or null if none */
    public Map.Entry<Key, Val> arb();

    /**
     * Looks up <code>key</code>, distinguishing a key which is present (whatever
     * its value, <code>null</code> included) from one which is absent.
     *
     * @param key the key to look up
     * @return the lookup result
     */
    public Lookup<Val> fetch(Object key);

    /**
     * Returns a new map which maps <code>key</code> to <code>value</code>, and
     * which otherwise contains exactly the same mappings as this map.
     *
     * <p>The default value of the result (the value returned by <code>get</code> of
     * a key not in the map) is that of this map.
     *
     * @param key the key whose value is to be added or changed
     * @param value the new value
     * @return the updated map
     */
    public PureMap<Key, Val> with(Key key, Val value);

    /**
     * Like <code>with</code>, except that if this map already contains
     * <code>key</code> it is returned unchanged.
     *
     * @param key the key to be added
     * @param value its value
     * @return the updated map, or this map
     */
    public PureMap<Key, Val> withIfAbsent(Key key, Val value);

    /**
     * Like <code>withIfAbsent</code>, except that if this map already contains
     * <code>key</code> an exception is thrown.
     *
     * @param key the key to be added
     * @param value its value
     * @return the updated map
     * @throws KeyConflictException if this map already contains <code>key</code>
     */
    public PureMap<Key, Val> withNew(Key key, Val value);

    /**
     * Returns a new map which contains no mapping for <code>key</code>, and which
     * otherwise contains exactly the same mappings as this map.  (No exception is
     * thrown if this map did not contain a mapping for <code>key</code>; in that
     * case, the returned map is equal to this map.)
     *
     * <p>The default value of the result (the value returned by <code>get</code> of
     * a key not in the map) is that of this map.
     *
     * @param key the key to be removed
     * @return the updated map
     */
    public PureMap<Key, Val> less(Key key);

    /**
     * Removes <code>key</code>, returning both its former value and the updated
     * map.  If <code>key</code> is not in this map, the value is this map's default
     * and the map is this map.
     *
     * @param key the key to be removed
     * @return the former value and the updated map
     */
    public Result<Val, Key, Val> pop(Key key);

    /**
     * Reads the value of <code>key</code> and updates it in one step.  The
     * updater receives the current value (this map's default if <code>key</code>
     * is absent) and answers a {@link Change}: either a value to return together
     * with a new value to store under <code>key</code>, or a request to remove
     * <code>key</code>, in which case the former value is returned.
     *
     * @param key the key to be updated
     * @param updater computes the change
     * @return the returned value and the updated map
     * @throws NullPointerException if the updater returns <code>null</code>
     */
    public <R> Result<R, Key, Val> getAndUpdate(Key key, Updater<Val, R> updater);

    /**
     * Adds the pairs of <code>withMap</code> to this map, returning the result.
     * For each key, if it appears in both maps, its value in the result is that in
     * <code>withMap</code>.  That is, the values in <code>withMap</code> take
     * precedence.
     *
     * @param withMap the map to merge with
     * @return the result of the merge
     */
    public PureMap<Key, Val> union(Map<? extends Key, ? extends Val> withMap);

    /**
     * Returns the default value for the map.
     *
     * Returns the value that <code>get</code> will return when invoked on a key
     * which is not in the map.  This is <code>null</code> by default, but can be
     * some other value if the map was created with the <code>withDefault</code>
     * static factory method.
     *
     * @return the default value for the map
     */
    public Val getDefault();

    /**
     * Returns an iterator that enumerates the pairs of this map.
     *
     * <p>{@link Map} does not declare an <code>iterator</code> method.  Rather, it
     * requires clients to call <code>entrySet</code>, then call
     * <code>iterator</code> on the result.  We encourage <code>PureMap</code>
     * clients to call <code>iterator</code> directly on the map, though both
     * protocols are supported.
     *
     * @return the iterator
     */
    public Iterator<Map.Entry<Key, Val>> iterator();

}
