package com.marginledger.index;

import com.marginledger.ledger.LedgerTransaction;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Non-owning reverse listing of account → order ids and account → position ids.
 *
 * <p>Used only for enumeration. The books add and remove entries in the same transaction
 * as the primary record, so the index never lists an id whose record is gone.
 */
@Component
public class TraderIndex {

    private final Map<String, NavigableSet<Long>> ordersByAccount = new HashMap<>();
    private final Map<String, NavigableSet<Long>> positionsByAccount = new HashMap<>();

    public void addOrder(LedgerTransaction transaction, String account, long orderId) {
        add(transaction, ordersByAccount, account, orderId);
    }

    public void removeOrder(LedgerTransaction transaction, String account, long orderId) {
        remove(transaction, ordersByAccount, account, orderId);
    }

    public void addPosition(LedgerTransaction transaction, String account, long positionId) {
        add(transaction, positionsByAccount, account, positionId);
    }

    public void removePosition(LedgerTransaction transaction, String account, long positionId) {
        remove(transaction, positionsByAccount, account, positionId);
    }

    /** Order ids of an account in ascending order. */
    public List<Long> getOrderIds(String account) {
        return snapshot(ordersByAccount, account);
    }

    /** Position ids of an account in ascending order. */
    public List<Long> getPositionIds(String account) {
        return snapshot(positionsByAccount, account);
    }

    private static void add(
            LedgerTransaction transaction, Map<String, NavigableSet<Long>> index, String account, long id) {
        if (index.computeIfAbsent(account, k -> new TreeSet<>()).add(id)) {
            transaction.onRollback(() -> drop(index, account, id));
        }
    }

    private static void remove(
            LedgerTransaction transaction, Map<String, NavigableSet<Long>> index, String account, long id) {
        if (drop(index, account, id)) {
            transaction.onRollback(
                    () -> index.computeIfAbsent(account, k -> new TreeSet<>()).add(id));
        }
    }

    private static boolean drop(Map<String, NavigableSet<Long>> index, String account, long id) {
        NavigableSet<Long> ids = index.get(account);
        if (ids == null || !ids.remove(id)) {
            return false;
        }
        if (ids.isEmpty()) {
            index.remove(account);
        }
        return true;
    }

    private static List<Long> snapshot(Map<String, NavigableSet<Long>> index, String account) {
        NavigableSet<Long> ids = index.get(account);
        return ids == null ? List.of() : List.copyOf(ids);
    }
}
