package com.delangzeta.realtime.ingestion.connector;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.datatypes.Event;

import java.util.List;

/**
 * web3j event plus the parameter names in declaration order.
 */
public record ContractEventDefinition(Event event, List<String> parameterNames) {

    public ContractEventDefinition {
        if (event.getParameters().size() != parameterNames.size()) {
            throw new IllegalArgumentException("Parameter names do not match event " + event.getName());
        }
    }

    public String name() {
        return event.getName();
    }

    public String topic() {
        return EventEncoder.encode(event);
    }
}
