package sh.harold.flotilla.cluster.command.commands;

import sh.harold.flotilla.api.command.CommandResult;
import sh.harold.flotilla.cluster.admission.AdmissionController;
import sh.harold.flotilla.cluster.admission.AdmissionResult;
import sh.harold.flotilla.cluster.command.CommandHandler;
import sh.harold.flotilla.cluster.command.CommandInvocation;
import sh.harold.flotilla.cluster.command.CommandRegistry;
import sh.harold.flotilla.cluster.config.ClusterManagerConfig;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Starts a password protected instance owned by the issuing user
 */
public class PrivateHostCommand implements CommandHandler {
    private final AdmissionController admission;
    private final Supplier<ClusterManagerConfig> config;

    public PrivateHostCommand(AdmissionController admission, Supplier<ClusterManagerConfig> config) {
        this.admission = Objects.requireNonNull(admission, "admission");
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public CommandResult execute(CommandInvocation invocation) {
        if (invocation.parameterCount() > 2) {
            return CommandRegistry.invalidSyntax(this);
        }
        String cluster = invocation.parameter(0).orElseGet(() -> config.get().defaultCluster());
        Optional<String> password = invocation.parameter(1);

        AdmissionResult result = admission.admitPrivate(cluster, invocation.user(), password);
        return result.isAdmitted() ? CommandResult.ok(result.message()) : CommandResult.failure(result.message());
    }

    @Override
    public String getName() {
        return "privateHost";
    }

    @Override
    public String[] getAliases() {
        return new String[0];
    }

    @Override
    public String getDescription() {
        return "Start a private instance in a cluster (default cluster if none given)";
    }

    @Override
    public String getUsage() {
        return "privateHost [cluster [password]]";
    }
}
