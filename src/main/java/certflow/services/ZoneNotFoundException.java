package certflow.services;

import certflow.model.FailureKind;
import java.util.List;

public class ZoneNotFoundException extends WorkflowStepException {

    private final List<String> dnsNames;

    public ZoneNotFoundException(List<String> dnsNames) {
        super(FailureKind.PRECONDITION, "DNS zone(s) are not found. DnsNames = " + String.join(",", dnsNames));
        this.dnsNames = List.copyOf(dnsNames);
    }

    public List<String> getDnsNames() {
        return dnsNames;
    }
}
