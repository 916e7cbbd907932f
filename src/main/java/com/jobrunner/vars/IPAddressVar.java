package com.jobrunner.vars;

import com.jobrunner.core.ValidationException;

import java.net.InetAddress;

/**
 * An IPv4 or IPv6 address without a mask.
 */
public class IPAddressVar extends JobVariable<InetAddress, IPAddressVar> {

    public IPAddressVar() {
        super(InetAddress.class);
    }

    @Override
    protected IPAddressVar self() {
        return this;
    }

    @Override
    protected InetAddress convert(Object raw, VariableServices services) throws ValidationException {
        if (raw instanceof InetAddress) {
            return (InetAddress) raw;
        }
        String text = scalarText(raw);
        if (text.contains("/")) {
            throw invalid("Please specify an address without a mask.");
        }
        try {
            return IPNetwork.parseAddress(text);
        } catch (IllegalArgumentException e) {
            throw invalid("Please specify a valid IPv4 or IPv6 address.");
        }
    }

    @Override
    public Object serialize(InetAddress value, VariableServices services) {
        return value == null ? null : value.getHostAddress();
    }
}
