package com.example.issuance.registry;

import com.example.issuance.model.Address;
import com.example.issuance.model.IssuerRecord;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Process-wide registry state: the dense issuer list, the membership set, the per-issuer
 * records indexed by identity and the cooldown table.
 * <p>
 * Every record's {@code position} equals its identity's index in the list. The mutators
 * below keep that true; callers run their guards before calling them.
 */
public class RegistryState {

    private final List<Address> issuerList = new ArrayList<>();
    private final Set<Address> membership = new HashSet<>();
    private final Map<Address, IssuerRecord> records = new HashMap<>();
    private final Map<Address, Long> cooldownUntil = new HashMap<>();
    private int totalIssuers;

    public int totalIssuers() {
        return totalIssuers;
    }

    public boolean isMember(Address identity) {
        return membership.contains(identity);
    }

    public IssuerRecord record(Address identity) {
        return records.get(identity);
    }

    public int size() {
        return issuerList.size();
    }

    public Address issuerAt(int index) {
        return issuerList.get(index);
    }

    public List<Address> issuers() {
        return List.copyOf(issuerList);
    }

    Map<Address, Long> cooldowns() {
        return cooldownUntil;
    }

    IssuerRecord append(Address identity, long startBlock, long expirationBlock) {
        IssuerRecord record = new IssuerRecord(issuerList.size(), startBlock, expirationBlock);
        issuerList.add(identity);
        membership.add(identity);
        records.put(identity, record);
        totalIssuers++;
        return record;
    }

    /**
     * Swap-and-truncate removal: the last identity moves into the freed slot.
     */
    void remove(Address identity) {
        IssuerRecord record = records.get(identity);
        int idx = record.getPosition();
        int last = issuerList.size() - 1;
        if (idx != last) {
            Address moved = issuerList.get(last);
            issuerList.set(idx, moved);
            records.get(moved).setPosition(idx);
        }
        issuerList.remove(last);
        membership.remove(identity);
        records.remove(identity);
        totalIssuers--;
    }

    /**
     * Moves {@code from}'s record verbatim to {@code to}, keeping its list slot.
     */
    IssuerRecord replace(Address from, Address to) {
        IssuerRecord migrated = records.get(from).copy();
        issuerList.set(migrated.getPosition(), to);
        membership.remove(from);
        records.remove(from);
        membership.add(to);
        records.put(to, migrated);
        return migrated;
    }

    /**
     * Verifies the list/membership/record invariants.
     *
     * @throws IllegalStateException describing the first violation found
     */
    public void assertConsistent() {
        if (issuerList.size() != totalIssuers || membership.size() != totalIssuers) {
            throw new IllegalStateException("Issuer count mismatch: list=" + issuerList.size()
                    + ", total=" + totalIssuers + ", members=" + membership.size());
        }
        if (records.size() != totalIssuers) {
            throw new IllegalStateException("Record count " + records.size() + " != " + totalIssuers);
        }
        for (int i = 0; i < issuerList.size(); i++) {
            Address identity = issuerList.get(i);
            IssuerRecord record = records.get(identity);
            if (!membership.contains(identity) || record == null) {
                throw new IllegalStateException("Listed issuer without membership or record: " + identity);
            }
            if (record.getPosition() != i) {
                throw new IllegalStateException("Issuer " + identity + " at index " + i
                        + " has position " + record.getPosition());
            }
        }
    }
}
