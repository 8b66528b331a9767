package com.polymind.ingestion.decoder;

import org.web3j.abi.EventEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * ABI definitions and topic0 hashes of the decoded events.
 */
public final class EventSignatures {

    /** CTF exchange: OrderFilled(bytes32,address,address,uint256,uint256,uint256,uint256,uint256). */
    public static final Event ORDER_FILLED = new Event("OrderFilled", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {},
            new TypeReference<Uint256>() {}));

    /** ConditionalTokens: ConditionPreparation(bytes32,address,bytes32,uint256). */
    public static final Event CONDITION_PREPARATION = new Event("ConditionPreparation", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Uint256>() {}));

    /** ConditionalTokens: ConditionResolution(bytes32,address,bytes32,uint256,uint256[]). */
    public static final Event CONDITION_RESOLUTION = new Event("ConditionResolution", Arrays.<TypeReference<?>>asList(
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Address>(true) {},
            new TypeReference<Bytes32>(true) {},
            new TypeReference<Uint256>() {},
            new TypeReference<DynamicArray<Uint256>>() {}));

    public static final String ORDER_FILLED_TOPIC = EventEncoder.encode(ORDER_FILLED);
    public static final String CONDITION_PREPARATION_TOPIC = EventEncoder.encode(CONDITION_PREPARATION);
    public static final String CONDITION_RESOLUTION_TOPIC = EventEncoder.encode(CONDITION_RESOLUTION);

    private static final Map<String, EventKind> KIND_BY_TOPIC = Map.of(
            ORDER_FILLED_TOPIC, EventKind.TRADE_FILLED,
            CONDITION_PREPARATION_TOPIC, EventKind.MARKET_CREATED,
            CONDITION_RESOLUTION_TOPIC, EventKind.MARKET_RESOLVED);

    private EventSignatures() {
    }

    public static EventKind kindOf(String topic0) {
        if (topic0 == null) {
            return EventKind.UNRECOGNIZED;
        }
        return KIND_BY_TOPIC.getOrDefault(topic0.toLowerCase(Locale.ROOT), EventKind.UNRECOGNIZED);
    }

    /** topic0 values requested from eth_getLogs. */
    public static List<String> watchedTopics() {
        return List.of(CONDITION_PREPARATION_TOPIC, CONDITION_RESOLUTION_TOPIC, ORDER_FILLED_TOPIC);
    }
}
