package com.opsdiag.k8s;

import com.opsdiag.model.DeploymentSummary;
import com.opsdiag.model.K8sEvent;
import java.time.Instant;
import java.util.List;

public interface K8sConnector {
    List<DeploymentSummary> listDeployments(String namespace);

    List<K8sEvent> getEvents(String namespace, Instant from, Instant to);
}
