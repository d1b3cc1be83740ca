package netops.gateway.service;

import netops.gateway.model.Task;

/**
 * Observer of task lifecycle changes. Called after the store has released its lock,
 * once per creation and once per status change.
 */
@FunctionalInterface
public interface TaskListener {

    void onTaskChanged(Task task);
}
