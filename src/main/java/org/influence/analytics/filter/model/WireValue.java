package org.influence.analytics.filter.model;

/**
 * A closed enumeration whose members are identified by the value the caller sends.
 */
public interface WireValue {

    String getWireValue();
}
