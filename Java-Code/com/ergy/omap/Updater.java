/*
 * Updater.java
 *
 * Copyright (c) 2013, 2014 Scott L. Burson.
 *
 * This file is licensed under the Library GNU Public License (LGPL), v. 2.1.
 */


package com.ergy.omap;

/**
 * Computes the change {@link PureMap#getAndUpdate} makes to one key.
 *
 * @author Scott L. Burson
 */

public interface Updater<Val, R> {

    /**
     * @param current the current value of the key, or the map's default if the key
     * is absent
     * @return the change to make; must not be <code>null</code>
     */
    Change<R, Val> update(Val current);

}
