package com.example.clusteragent.cluster;

import java.util.List;

/**
 * Cluster CLI collaborator. Arguments exclude the binary and the connection flags,
 * which the implementation derives from the {@link ClusterContext}.
 */
public interface ClusterClient {

    CommandResult run(List<String> args, ClusterContext context);
}
