package com.opsdiag.report;

import com.opsdiag.model.DeploymentHint;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

@ApplicationScoped
public class LoggingDeploymentHintPublisher implements DeploymentHintPublisher {

    private static final Logger LOGGER = Logger.getLogger("ENGINE.DeploymentHintPublisher");

    @Override
    public void publish(DeploymentHint hint) {
        LOGGER.infov(
                "[DEPLOYMENT-HINT] service={0} repository={1} commit={2}",
                hint.service(),
                hint.repository(),
                hint.commit());
    }
}
