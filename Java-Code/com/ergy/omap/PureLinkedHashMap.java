/*
 * PureLinkedHashMap.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

import java.util.*;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A pure map that remembers the order in which its keys were first added.  The
 * iterator, <code>keySet</code>, <code>values</code>, <code>keyList</code>,
 * <code>valueList</code>, <code>slice</code>, <code>reduce</code> and
 * <code>toString</code> all present the entries oldest first.  Changing the value
 * of a key which is already in the map (with <code>with</code>) leaves the key
 * where it was; removing a key and adding it again moves it to the end.
 *
 * <p>Internally the map is two pure structures kept in step: a chain of the keys,
 * most recent first, and a tree ordered by key hash code which maps each key to
 * its value.  The size is cached.  No other class touches either structure, and
 * every operation that changes one changes the other in the same step.
 *
 * <p>Time costs: <code>isEmpty</code>, <code>size</code>, <code>arb</code> and
 * <code>lastEntry</code> take O(1) (constant) time.  <code>containsKey</code>,
 * <code>get</code>, <code>fetch</code> and <code>with</code> take O(log <i>n</i>)
 * time.  <code>less</code> and <code>pop</code> take O(<i>n</i>) time in the worst
 * case, since they copy the part of the key chain newer than the key removed.
 * The first traversal of a map (by iterator, <code>slice</code>,
 * <code>reduce</code>, <code>keyList</code> and the like) takes O(<i>n</i>) time
 * to put the keys in insertion order; the result is cached, and each entry
 * visited then costs O(log <i>n</i>).
 *
 * <p>Presence is a property of the key alone: a key mapped to <code>null</code>,
 * <code>Boolean.FALSE</code>, zero or the empty string is present, and
 * <code>containsKey</code>, <code>fetch</code>, <code>getOrDefault</code>,
 * <code>withIfAbsent</code> and <code>withNew</code> treat it so.
 *
 * <p><code>PureLinkedHashMap</code> accepts the null key and the null value.
 *
 * <p><code>PureLinkedHashMap</code> also provides, corresponding to each
 * constructor, a static factory method <code>withDefault</code> which, in
 * addition to the functionality of the constructor, also allows the specification
 * of a default value to be returned by the <code>get</code> method when it is
 * called with a key which is not in the map.
 *
 * <p>Equality follows the {@link Map} contract, so two maps with the same entries
 * in different orders are <code>equals</code>; use <code>equalsInOrder</code> to
 * compare the orders as well.
 *
 * <p>Instances are immutable and may be shared freely between threads.
 *
 * @author Scott L. Burson
 * @see PureMap
 */

public class PureLinkedHashMap<Key, Val>
    extends AbstractPureMap<Key, Val>
{

    /**
     * Constructs an empty <code>PureLinkedHashMap</code>.
     */
    public PureLinkedHashMap() {
	this(null, null, 0, null);
    }

    /**
     * Constructs a <code>PureLinkedHashMap</code> containing the same entries as
     * <code>map</code>, in the order of <code>map</code>'s iterator.
     *
     * @param map the map to use the entries of
     */
    public PureLinkedHashMap(Map<? extends Key, ? extends Val> map) {
	if (map instanceof PureLinkedHashMap) {
	    PureLinkedHashMap<? extends Key, ? extends Val> plhm =
		(PureLinkedHashMap<? extends Key, ? extends Val>)map;
	    keys = plhm.keys;
	    table = plhm.table;
	    size = plhm.size;
	} else {
	    PureLinkedHashMap<Key, Val> m = new PureLinkedHashMap<Key, Val>().withAll(map.entrySet());
	    keys = m.keys;
	    table = m.table;
	    size = m.size;
	}
	dflt = null;
    }

    /**
     * Constructs and returns an empty <code>PureLinkedHashMap</code> with default
     * <code>dflt</code>.  The resulting map's <code>get</code> method returns
     * <code>dflt</code> when called with a key which is not in the map.
     *
     * @param dflt the default value
     * @return the new <code>PureLinkedHashMap</code>
     */
    public static <Key, Val> PureLinkedHashMap<Key, Val> withDefault(Val dflt) {
	return new PureLinkedHashMap<Key, Val>(null, null, 0, dflt);
    }

    /**
     * Constructs and returns a <code>PureLinkedHashMap</code> with default
     * <code>dflt</code>, containing the same entries as <code>map</code>.
     *
     * @param map the map to use the entries of
     * @param dflt the default value
     * @return the new <code>PureLinkedHashMap</code>
     */
    public static <Key, Val> PureLinkedHashMap<Key, Val> withDefault(Map<? extends Key, ? extends Val> map,
								       Val dflt) {
	PureLinkedHashMap<Key, Val> m = new PureLinkedHashMap<Key, Val>(map);
	return new PureLinkedHashMap<Key, Val>(m.keys, m.table, m.size, dflt);
    }

    /**
     * Constructs a <code>PureLinkedHashMap</code> from a sequence of pairs, adding
     * them left to right with <code>with</code>.  If a key occurs more than once,
     * it keeps the position of its first occurrence and the value of its last.
     *
     * @param pairs the pairs to add
     * @return the new <code>PureLinkedHashMap</code>
     */
    public static <Key, Val> PureLinkedHashMap<Key, Val>
	from(Iterable<? extends Map.Entry<? extends Key, ? extends Val>> pairs) {
	return new PureLinkedHashMap<Key, Val>().withAll(pairs);
    }

    /**
     * Returns a {@link Collector} that gathers a stream of pairs into a
     * <code>PureLinkedHashMap</code>, in encounter order, as <code>from</code>
     * would.
     */
    public static <Key, Val> Collector<Map.Entry<Key, Val>, ?, PureLinkedHashMap<Key, Val>> collector() {
	return Collector.of(
	    new Supplier<ArrayList<Map.Entry<Key, Val>>>() {
		public ArrayList<Map.Entry<Key, Val>> get() {
		    return new ArrayList<Map.Entry<Key, Val>>();
		}
	    },
	    new BiConsumer<ArrayList<Map.Entry<Key, Val>>, Map.Entry<Key, Val>>() {
		public void accept(ArrayList<Map.Entry<Key, Val>> pairs, Map.Entry<Key, Val> ent) {
		    pairs.add(ent);
		}
	    },
	    new BinaryOperator<ArrayList<Map.Entry<Key, Val>>>() {
		public ArrayList<Map.Entry<Key, Val>> apply(ArrayList<Map.Entry<Key, Val>> a,
							    ArrayList<Map.Entry<Key, Val>> b) {
		    a.addAll(b);
		    return a;
		}
	    },
	    new Function<ArrayList<Map.Entry<Key, Val>>, PureLinkedHashMap<Key, Val>>() {
		public PureLinkedHashMap<Key, Val> apply(ArrayList<Map.Entry<Key, Val>> pairs) {
		    return PureLinkedHashMap.<Key, Val>from(pairs);
		}
	    });
    }

    public boolean isEmpty() {
	return size == 0;
    }

    public int size() {
	return size;
    }

    /**
     * Returns the most recently added entry, or <code>null</code> if the map is
     * empty.
     */
    public Map.Entry<Key, Val> arb() {
	return lastEntry();
    }

    /**
     * Returns the oldest entry, or <code>null</code> if the map is empty.
     */
    public Map.Entry<Key, Val> firstEntry() {
	if (keys == null) return null;
	KeyChain link = keys;
	while (link.next != null) link = link.next;
	return entry(link.key, HashTree.lookup(table, link.key));
    }

    /**
     * Returns the most recently added entry, or <code>null</code> if the map is
     * empty.
     */
    public Map.Entry<Key, Val> lastEntry() {
	if (keys == null) return null;
	else return entry(keys.key, HashTree.lookup(table, keys.key));
    }

    public Lookup<Val> fetch(Object key) {
	Object val = HashTree.lookup(table, key);
	if (val == HashTree.NOT_FOUND) return Lookup.absent();
	else return Lookup.of((Val)val);
    }

    public boolean containsKey(Object key) {
	return HashTree.lookup(table, key) != HashTree.NOT_FOUND;
    }

    /**
     * A synonym for <code>containsKey</code>.
     */
    public boolean contains(Object key) {
	return containsKey(key);
    }

    /**
     * Returns the value to which this map maps <code>key</code>.  If this map
     * contains no entry for <code>key</code>, returns this map's default value,
     * which is normally <code>null</code>, but may be a different value if the map
     * was originally created by the <code>withDefault</code> static factory
     * method. */
    public Val get(Object key) {
	Object val = HashTree.lookup(table, key);
	return val == HashTree.NOT_FOUND ? dflt : (Val)val;
    }

    /**
     * Returns the value of <code>key</code>, or <code>otherwise</code> if this map
     * has no entry for it.  A present key always answers its own value, even a
     * <code>null</code> one.
     */
    public Val getOrDefault(Object key, Val otherwise) {
	Object val = HashTree.lookup(table, key);
	return val == HashTree.NOT_FOUND ? otherwise : (Val)val;
    }

    /**
     * Returns a map which maps <code>key</code> to <code>value</code>.  If
     * <code>key</code> was already present, it keeps its position; otherwise it
     * becomes the newest key.  If <code>key</code> was already mapped to
     * <code>value</code>, returns this map.
     */
    public PureLinkedHashMap<Key, Val> with(Key key, Val value) {
	HashTree.Node t = HashTree.with(table, key, value);
	if (t == table) return this;
	// The tree grows only if the key was not there.
	else if (HashTree.size(t) == size)
	    return new PureLinkedHashMap<Key, Val>(keys, t, size, dflt);
	else return new PureLinkedHashMap<Key, Val>(KeyChain.withFirst(keys, key), t, size + 1, dflt);
    }

    public PureLinkedHashMap<Key, Val> withIfAbsent(Key key, Val value) {
	if (containsKey(key)) return this;
	else return with(key, value);
    }

    public PureLinkedHashMap<Key, Val> withNew(Key key, Val value) {
	if (containsKey(key)) throw new KeyConflictException(key, this);
	else return with(key, value);
    }

    /**
     * Adds each of <code>pairs</code>, left to right, with <code>with</code>.
     *
     * @param pairs the pairs to add
     * @return the updated map
     */
    public PureLinkedHashMap<Key, Val> withAll(Iterable<? extends Map.Entry<? extends Key, ? extends Val>> pairs) {
	PureLinkedHashMap<Key, Val> res = this;
	for (Map.Entry<? extends Key, ? extends Val> ent : pairs)
	    res = res.with(ent.getKey(), ent.getValue());
	return res;
    }

    public PureLinkedHashMap<Key, Val> less(Key key) {
	HashTree.Node t = HashTree.less(table, key);
	if (t == table) return this;
	else return new PureLinkedHashMap<Key, Val>(KeyChain.less(keys, key), t, size - 1, dflt);
    }

    public OrderedResult<Val, Key, Val> pop(Key key) {
	Object val = HashTree.lookup(table, key);
	if (val == HashTree.NOT_FOUND) return new OrderedResult<Val, Key, Val>(dflt, this);
	else return new OrderedResult<Val, Key, Val>((Val)val, less(key));
    }

    public <R> OrderedResult<R, Key, Val> getAndUpdate(Key key, Updater<Val, R> updater) {
	Result<R, Key, Val> res = super.getAndUpdate(key, updater);
	return new OrderedResult<R, Key, Val>(res.getValue(), (PureLinkedHashMap<Key, Val>)res.getMap());
    }

    /**
     * Adds the pairs of <code>withMap</code> to this map, in the order of its
     * iterator; keys new to this map follow the existing ones.
     */
    public PureLinkedHashMap<Key, Val> union(Map<? extends Key, ? extends Val> withMap) {
	return withAll(withMap.entrySet());
    }

    /**
     * Returns the keys, oldest first.  The list is a fresh copy.
     */
    public List<Key> keyList() {
	Object[] ord = orderedKeys();
	ArrayList<Key> res = new ArrayList<Key>(ord.length);
	for (Object k : ord) res.add((Key)k);
	return res;
    }

    /**
     * Returns the values, in the order of <code>keyList</code>.  The list is a
     * fresh copy.
     */
    public List<Val> valueList() {
	Object[] ord = orderedKeys();
	ArrayList<Val> res = new ArrayList<Val>(ord.length);
	for (Object k : ord) res.add((Val)HashTree.lookup(table, k));
	return res;
    }

    /**
     * Returns up to <code>length</code> entries starting at position
     * <code>start</code> (0 being the oldest).  Asking for more entries than
     * remain returns just those that remain; a <code>start</code> at or past the
     * end, or a <code>length</code> of zero or less, returns an empty list.  A
     * negative <code>start</code> counts back from the end.
     *
     * @param start the position of the first entry
     * @param length the largest number of entries to return
     * @return the entries, in order
     */
    public List<Map.Entry<Key, Val>> slice(int start, int length) {
	if (start < 0) start = Math.max(size + start, 0);
	if (length <= 0 || start >= size) return new ArrayList<Map.Entry<Key, Val>>(0);
	int end = (int)Math.min((long)start + length, (long)size);
	Object[] ord = orderedKeys();
	ArrayList<Map.Entry<Key, Val>> res = new ArrayList<Map.Entry<Key, Val>>(end - start);
	for (int i = start; i < end; ++i) res.add(entry(ord[i], HashTree.lookup(table, ord[i])));
	return res;
    }

    /**
     * Folds the entries, oldest first, into <code>initial</code>.  At each entry the
     * reducer answers a {@link Step}: <code>cont</code> goes on to the next entry,
     * <code>halt</code> stops, and <code>suspend</code> returns a {@link Reduction}
     * which can be resumed from the next entry.
     *
     * @param initial the initial accumulator
     * @param reducer folds one entry
     * @return the outcome
     * @throws NullPointerException if the reducer returns <code>null</code>
     */
    public <Acc> Reduction<Acc> reduce(Acc initial, Reducer<Key, Val, Acc> reducer) {
	return reduce(Step.cont(initial), reducer);
    }

    /**
     * Like the other <code>reduce</code>, but starts with an arbitrary signal, so
     * that a reduction may be suspended (or halted) before the first entry.
     */
    public <Acc> Reduction<Acc> reduce(Step<Acc> signal, Reducer<Key, Val, Acc> reducer) {
	if (signal == null) throw new NullPointerException("initial step is null");
	return new Traversal<Key, Val, Acc>(orderedKeys(), table, 0, reducer).run(signal);
    }

    public Set<Map.Entry<Key, Val>> entrySet() {
	return new AbstractSet<Map.Entry<Key, Val>>() {
	    public Iterator<Map.Entry<Key, Val>> iterator() {
		return PureLinkedHashMap.this.iterator();
	    }
	    public int size() {
		return size;
	    }
	    public boolean contains(Object obj) {
		if (!(obj instanceof Map.Entry)) return false;
		Map.Entry<?, ?> ent = (Map.Entry<?, ?>)obj;
		Object val = HashTree.lookup(table, ent.getKey());
		return val != HashTree.NOT_FOUND && HashTree.eql(val, ent.getValue());
	    }
	};
    }

    public Val getDefault() {
	return dflt;
    }

    public Iterator<Map.Entry<Key, Val>> iterator() {
	return new PLHMIterator<Key, Val>(orderedKeys(), table);
    }

    public boolean equals(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof Map)) return false;
	else {
	    Map<?, ?> map = (Map<?, ?>)obj;
	    if (size != map.size()) return false;
	    for (Map.Entry<?, ?> ent : map.entrySet()) {
		Object val = HashTree.lookup(table, ent.getKey());
		if (val == HashTree.NOT_FOUND || !HashTree.eql(val, ent.getValue())) return false;
	    }
	    return true;
	}
    }

    /**
     * Like <code>equals</code>, but also requires <code>obj</code> to be a
     * <code>PureLinkedHashMap</code> with its keys in the same order.
     */
    public boolean equalsInOrder(Object obj) {
	if (obj == this) return true;
	else if (!(obj instanceof PureLinkedHashMap) || !equals(obj)) return false;
	else return Arrays.equals(orderedKeys(), ((PureLinkedHashMap<?, ?>)obj).orderedKeys());
    }

    public int hashCode() {
	if (hash_code == Integer.MIN_VALUE) {
	    int hash = 0;
	    for (KeyChain link = keys; link != null; link = link.next) {
		Object val = HashTree.lookup(table, link.key);
		hash += HashTree.hashCode(link.key) ^ (val == null ? 0 : val.hashCode());
	    }
	    hash_code = hash;
	}
	return hash_code;
    }

    /*package*/ String dump() {
	StringBuilder str_buf = new StringBuilder("[");
	for (KeyChain link = keys; link != null; link = link.next) {
	    str_buf.append(link.key);
	    if (link.next != null) str_buf.append(", ");
	}
	str_buf.append("] size ");
	str_buf.append(size);
	str_buf.append("\n");
	str_buf.append(HashTree.dump(table));
	return str_buf.toString();
    }

    /**
     * Checks that the key chain and the tree hold the same keys, each once, and
     * that both agree with the cached size.
     */
    /*package*/ boolean verify() {
	if (!HashTree.verify(table)) return false;
	if (size < 0 || HashTree.size(table) != size || KeyChain.length(keys) != size) return false;
	HashTree.Node seen = null;
	for (KeyChain link = keys; link != null; link = link.next) {
	    if (HashTree.lookup(table, link.key) == HashTree.NOT_FOUND) return false;
	    if (HashTree.lookup(seen, link.key) != HashTree.NOT_FOUND) return false;
	    seen = HashTree.with(seen, link.key, Boolean.TRUE);
	}
	return true;
    }

    /******************************************************************************/
    /* Internals */

    private PureLinkedHashMap(KeyChain _keys, HashTree.Node _table, int _size, Val _dflt) {
	keys = _keys;
	table = _table;
	size = _size;
	dflt = _dflt;
    }

    /* Instance variables */

    private final KeyChain keys;		// most recent first
    private final HashTree.Node table;
    private final int size;

    private final Val dflt;

    // We use Integer.MIN_VALUE to indicate that the hash code has not been computed yet.
    private transient int hash_code = Integer.MIN_VALUE;

    // The keys oldest first; computed when first needed.
    private transient volatile Object[] ordered_keys;

    private Object[] orderedKeys() {
	Object[] ord = ordered_keys;
	if (ord == null) {
	    ord = KeyChain.toInsertionOrder(keys, size);
	    ordered_keys = ord;
	}
	return ord;
    }

    private static <Key, Val> Map.Entry<Key, Val> entry(Object key, Object value) {
	return new AbstractMap.SimpleImmutableEntry<Key, Val>((Key)key, (Val)value);
    }

    /****************/
    // Reduction

    /* A reduction paused before position `pos'.  Immutable, so a suspended
     * reduction can be resumed any number of times. */
    static final class Traversal<Key, Val, Acc> {

	Traversal(Object[] _keys, HashTree.Node _table, int _pos, Reducer<Key, Val, Acc> _reducer) {
	    keys = _keys;
	    table = _table;
	    pos = _pos;
	    reducer = _reducer;
	}

	private final Object[] keys;
	private final HashTree.Node table;
	private final int pos;
	private final Reducer<Key, Val, Acc> reducer;

	Reduction<Acc> run(Step<Acc> signal) {
	    int i = pos;
	    while (true) {
		switch (signal.getKind()) {
		case HALT:
		    return new Reduction<Acc>(Reduction.Status.HALTED, signal.getAccumulator(), null);
		case SUSPEND:
		    return new Reduction<Acc>(Reduction.Status.SUSPENDED, signal.getAccumulator(),
					      new Traversal<Key, Val, Acc>(keys, table, i, reducer));
		default:
		    if (i == keys.length)
			return new Reduction<Acc>(Reduction.Status.DONE, signal.getAccumulator(), null);
		    Object k = keys[i++];
		    signal = reducer.step(PureLinkedHashMap.<Key, Val>entry(k, HashTree.lookup(table, k)),
					  signal.getAccumulator());
		if (signal == null) throw new NullPointerException("reducer returned null for key " + k);
		}
	    }
	}
    }

    /****************/
    // Iterator class

    private static final class PLHMIterator<Key, Val> implements Iterator<Map.Entry<Key, Val>> {

	private PLHMIterator(Object[] _keys, HashTree.Node _table) {
	    keys = _keys;
	    table = _table;
	}

	private final Object[] keys;
	private final HashTree.Node table;
	private int index = 0;

	public boolean hasNext() {
	    return index < keys.length;
	}

	public Map.Entry<Key, Val> next() {
	    if (index >= keys.length) throw new NoSuchElementException();
	    Object k = keys[index++];
	    return PureLinkedHashMap.<Key, Val>entry(k, HashTree.lookup(table, k));
	}

	public void remove() {
	    throw new UnsupportedOperationException();
	}
    }

}
