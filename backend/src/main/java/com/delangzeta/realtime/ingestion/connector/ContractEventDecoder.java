package com.delangzeta.realtime.ingestion.connector;

import com.delangzeta.realtime.ingestion.adapter.RawLog;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.utils.Numeric;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Decodes raw logs against a set of event definitions, keyed by topic0.
 * Indexed dynamic values (strings) only survive as their keccak hash and come out as bytes32 hex.
 */
public class ContractEventDecoder {

    private final Map<String, ContractEventDefinition> definitionsByTopic;

    public ContractEventDecoder(List<ContractEventDefinition> definitions) {
        this.definitionsByTopic = definitions.stream()
                .collect(Collectors.toMap(d -> d.topic().toLowerCase(Locale.ROOT), Function.identity()));
    }

    public static ContractEventDecoder universalContract() {
        return new ContractEventDecoder(UniversalContractEvents.ALL);
    }

    public DecodedLog decode(String chain, RawLog raw) {
        if (raw.removed()) {
            throw new MalformedLogException("Log removed by reorg: " + raw.transactionHash() + "#" + raw.logIndex());
        }
        if (raw.blockNumber() == null || raw.logIndex() == null || raw.transactionHash() == null) {
            throw new MalformedLogException("Log without block coordinates on " + chain);
        }
        String topic0 = raw.topic0();
        ContractEventDefinition definition = topic0 == null ? null : definitionsByTopic.get(topic0.toLowerCase(Locale.ROOT));
        if (definition == null) {
            throw new MalformedLogException("Unknown event topic " + topic0 + " in tx " + raw.transactionHash());
        }
        try {
            return new DecodedLog(chain, raw.contractAddress(), definition.name(), raw.blockNumber(),
                    raw.transactionHash(), raw.logIndex(), decodeFields(definition, raw));
        } catch (MalformedLogException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedLogException("Cannot decode " + definition.name() + " in tx " + raw.transactionHash(), e);
        }
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static Map<String, Object> decodeFields(ContractEventDefinition definition, RawLog raw) {
        List<TypeReference<Type>> indexed = definition.event().getIndexedParameters();
        List<TypeReference<Type>> nonIndexed = definition.event().getNonIndexedParameters();
        if (raw.topics().size() != indexed.size() + 1) {
            throw new MalformedLogException("Expected " + (indexed.size() + 1) + " topics for "
                    + definition.name() + ", got " + raw.topics().size());
        }
        List<Type> values = FunctionReturnDecoder.decode(raw.data(), nonIndexed);
        if (values.size() != nonIndexed.size()) {
            throw new MalformedLogException("Data of " + definition.name() + " has " + values.size()
                    + " values, expected " + nonIndexed.size());
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        int topicPos = 1;
        int dataPos = 0;
        List<TypeReference<Type>> parameters = (List) definition.event().getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            TypeReference<Type> parameter = parameters.get(i);
            Type value = parameter.isIndexed()
                    ? FunctionReturnDecoder.decodeIndexedValue(raw.topics().get(topicPos++), parameter)
                    : values.get(dataPos++);
            fields.put(definition.parameterNames().get(i), plain(value));
        }
        return fields;
    }

    private static Object plain(Type<?> value) {
        if (value instanceof Bool b) {
            return b.getValue();
        }
        if (value instanceof Address a) {
            return a.getValue().toLowerCase(Locale.ROOT);
        }
        if (value instanceof Uint256 u) {
            return u.getValue().toString();
        }
        if (value instanceof Bytes32 bytes) {
            return Numeric.toHexString(bytes.getValue());
        }
        if (value instanceof Utf8String s) {
            return s.getValue();
        }
        return String.valueOf(value.getValue());
    }
}
