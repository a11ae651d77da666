package com.netlink.osp.store;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import com.netlink.osp.network.Cable;
import com.netlink.osp.network.NetworkElement;
import com.netlink.osp.network.PonPort;
import com.netlink.osp.network.Port;
import com.netlink.osp.network.Splitter;
import com.netlink.osp.network.Tray;
import com.netlink.osp.splice.Splice;

/**
 * Local persistent state of one project.
 *
 * <p>
 * Records are handed over by value: {@code put*} stores a copy and lookups
 * return copies, so a caller mutating a returned object never changes the
 * store. An id of 0 on {@code put*} asks the store to allocate one; the
 * allocated id is written back to the argument and returned.
 *
 * <p>
 * {@link #inTransaction(Supplier)} is the unit of work: when the supplier
 * throws, every write made inside it is undone before the exception
 * propagates.
 */
public interface NetworkStore {

    long putElement(NetworkElement element);

    Optional<NetworkElement> findElement(long id);

    /** All elements in ascending id order. */
    List<NetworkElement> elements();

    void removeElement(long id);

    long putTray(Tray tray);

    Optional<Tray> findTray(long id);

    /** Trays of an enclosure ordered by tray number. */
    List<Tray> traysOf(long enclosureId);

    void removeTray(long id);

    long putPort(Port port);

    /** Ports of an enclosure ordered by port number. */
    List<Port> portsOf(long enclosureId);

    void removePort(long id);

    long putSplitter(Splitter splitter);

    Optional<Splitter> findSplitter(long id);

    /** Splitters of an enclosure in id order. */
    List<Splitter> splittersOf(long enclosureId);

    void removeSplitter(long id);

    long putPonPort(PonPort port);

    Optional<PonPort> findPonPort(long id);

    /** PON ports of an OLT ordered by port number. */
    List<PonPort> ponPortsOf(long oltId);

    void removePonPort(long id);

    long putCable(Cable cable);

    Optional<Cable> findCable(long id);

    List<Cable> cables();

    void removeCable(long id);

    long putSplice(Splice splice);

    Optional<Splice> findSplice(long id);

    Optional<Splice> findSplice(long trayId, int fiberA, int fiberB);

    /** Splices of a tray ordered by {@code (fiberA, fiberB)}. */
    List<Splice> splicesOf(long trayId);

    List<Splice> splices();

    void removeSplice(long id);

    <T> T inTransaction(Supplier<T> work);

    default void inTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }
}
