package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

import java.util.Map;

/**
 * An IPv4 or IPv6 prefix. The address must be the network address of the prefix,
 * and the prefix length may be bounded.
 */
public class IPNetworkVar extends JobVariable<IPNetwork, IPNetworkVar> {
    private Integer minPrefixLength;
    private Integer maxPrefixLength;

    public IPNetworkVar() {
        super(IPNetwork.class);
    }

    @Override
    protected IPNetworkVar self() {
        return this;
    }

    public IPNetworkVar minPrefixLength(int minPrefixLength) {
        this.minPrefixLength = minPrefixLength;
        return this;
    }

    public IPNetworkVar maxPrefixLength(int maxPrefixLength) {
        this.maxPrefixLength = maxPrefixLength;
        return this;
    }

    @Override
    protected IPNetwork convert(Object raw, VariableServices services) throws ValidationException {
        IPNetwork network = IPAddressWithMaskVar.parseNetwork(raw);
        if (!network.isNetworkAddress()) {
            throw invalid(network + " is not a valid prefix. Did you mean " + network.getNetwork() + "?");
        }
        if (minPrefixLength != null && network.getPrefixLength() < minPrefixLength) {
            throw invalid("The prefix length must be greater than or equal to " + minPrefixLength + ".");
        }
        if (maxPrefixLength != null && network.getPrefixLength() > maxPrefixLength) {
            throw invalid("The prefix length must be less than or equal to " + maxPrefixLength + ".");
        }
        return network;
    }

    @Override
    public Object serialize(IPNetwork value, VariableServices services) {
        return value == null ? null : value.toString();
    }

    @Override
    protected void describeConstraints(Map<String, Object> description) {
        description.put("min_prefix_length", minPrefixLength);
        description.put("max_prefix_length", maxPrefixLength);
    }
}
