package com.example.issuance.event;

import java.util.List;

/**
 * Append-only notification log. Appends made inside a transaction are discarded with it.
 */
public interface IssuerEventLog {

    void append(IssuerEvent event);

    /**
     * @return every entry in append order
     */
    List<IssuerEvent> entries();
}
