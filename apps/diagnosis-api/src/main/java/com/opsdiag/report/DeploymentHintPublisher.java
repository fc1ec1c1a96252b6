package com.opsdiag.report;

import com.opsdiag.model.DeploymentHint;

/**
 * Outbound boundary towards code-review collaborators (for example a PR comment bot).
 */
public interface DeploymentHintPublisher {

    void publish(DeploymentHint hint);
}
