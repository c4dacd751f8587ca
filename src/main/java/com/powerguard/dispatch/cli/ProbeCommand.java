package com.powerguard.dispatch.cli;

import com.powerguard.core.capability.CapabilityProber;
import com.powerguard.core.model.CapabilityDomain;
import com.powerguard.core.model.CapabilityTier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: powerguard probe [DOMAIN]
 * <p>
 * Probes the access tier of one capability domain, or of all of them.
 * Exit code 0 after probing, 2 for an unknown domain name.
 */
@Command(name = "probe", mixinStandardHelpOptions = true,
        description = "Probe which OS-access tier each capability domain can use")
@Component
public class ProbeCommand implements Callable<Integer> {

    @Parameters(index = "0", arity = "0..1", description = "Capability domain, e.g. IDLE_STATE")
    private String domain;

    @Option(names = {"--refresh", "-r"}, description = "Forget cached tiers before probing")
    private boolean refresh;

    private final CapabilityProber prober;

    public ProbeCommand(CapabilityProber prober) {
        this.prober = prober;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        List<CapabilityDomain> domains;
        try {
            domains = domain == null ? List.of(CapabilityDomain.values()) : List.of(CapabilityDomain.fromName(domain));
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        for (CapabilityDomain d : domains) {
            if (refresh) {
                prober.invalidate(d);
            }
            CapabilityTier tier = prober.probe(d);
            ConsoleOutput.tier(d.name(), tier);
        }
        return 0;
    }
}
