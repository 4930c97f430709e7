package io.borgqueue.scheduler;

import java.util.List;

/**
 * Supplies the maintenance jobs for one maintenance tick (e.g. stats collection per server).
 */
@FunctionalInterface
public interface MaintenanceTaskSource {

    List<MaintenanceTask> tasks();
}
