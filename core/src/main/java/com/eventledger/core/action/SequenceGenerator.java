package com.eventledger.core.action;

/**
 * Source of action ids. Ids must be strictly increasing in the order they are handed out.
 */
public interface SequenceGenerator {

    long next();
}
