package com.mk.fx.qa.fanout.execution.load;

import com.mk.fx.qa.fanout.execution.model.LoadProfile;
import java.util.List;

/** Everything observed during one load run. */
public record LoadRun(
    String implementation,
    LoadProfile profile,
    LoadProfileResult result,
    List<UserActivity> users,
    List<LoadProgress> progress,
    List<PhaseTransition> phases) {

  public int usersStarted() {
    return users.size();
  }
}
