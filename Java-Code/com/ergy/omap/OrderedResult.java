/*
 * OrderedResult.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * The {@link Result} of {@link PureLinkedHashMap#pop} and
 * {@link PureLinkedHashMap#getAndUpdate}, whose map keeps the ordered operations
 * (<code>keyList</code>, <code>slice</code>, <code>reduce</code>) in view.
 */

public final class OrderedResult<R, Key, Val> extends Result<R, Key, Val> {

    OrderedResult(R _value, PureLinkedHashMap<Key, Val> _map) {
	super(_value, _map);
    }

    public PureLinkedHashMap<Key, Val> getMap() {
	return (PureLinkedHashMap<Key, Val>)super.getMap();
    }

}
