package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

/**
 * An IPv4 or IPv6 address with a mask, e.g. an interface address such as {@code 192.0.2.10/24}.
 */
public class IPAddressWithMaskVar extends JobVariable<IPNetwork, IPAddressWithMaskVar> {

    public IPAddressWithMaskVar() {
        super(IPNetwork.class);
    }

    @Override
    protected IPAddressWithMaskVar self() {
        return this;
    }

    @Override
    protected IPNetwork convert(Object raw, VariableServices services) throws ValidationException {
        return parseNetwork(raw);
    }

    static IPNetwork parseNetwork(Object raw) throws ValidationException {
        if (raw instanceof IPNetwork) {
            return (IPNetwork) raw;
        }
        String text = scalarText(raw).strip();
        if (!text.contains("/")) {
            throw invalid("CIDR mask (e.g. /24) is required.");
        }
        try {
            return IPNetwork.parse(text);
        } catch (IllegalArgumentException e) {
            throw invalid("Please specify a valid IPv4 or IPv6 address.");
        }
    }

    @Override
    public Object serialize(IPNetwork value, VariableServices services) {
        return value == null ? null : value.toString();
    }
}
