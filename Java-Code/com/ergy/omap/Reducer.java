/*
 * Reducer.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;
import java.util.Map;

/**
 * One step of a reduction over the entries of a map.
 *
 * @author Scott L. Burson
 */

public interface Reducer<Key, Val, Acc> {

    /**
     * Folds <code>entry</code> into <code>acc</code>.
     *
     * @return the signal saying how to go on; must not be <code>null</code>
     */
    Step<Acc> step(Map.Entry<Key, Val> entry, Acc acc);

}
