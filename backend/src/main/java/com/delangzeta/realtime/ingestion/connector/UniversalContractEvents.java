package com.delangzeta.realtime.ingestion.connector;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.List;

/**
 * Events emitted by the universal (omnichain) platform contract deployed on every supported chain.
 */
public final class UniversalContractEvents {

    public static final String TASK_CREATED = "TaskCreatedOmnichain";
    public static final String DATA_SUBMITTED = "DataSubmittedOmnichain";
    public static final String VERIFICATION_COMPLETE = "VerificationCompleteOmnichain";
    public static final String REWARD_DISTRIBUTED = "RewardDistributedOmnichain";
    public static final String CROSS_CHAIN_OPERATION_COMPLETE = "CrossChainOperationComplete";

    public static final ContractEventDefinition TASK_CREATED_EVENT = new ContractEventDefinition(
            new Event(TASK_CREATED, List.of(
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Address>(true) {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Address>() {})),
            List.of("taskId", "creator", "sourceChainId", "reward", "paymentToken"));

    public static final ContractEventDefinition DATA_SUBMITTED_EVENT = new ContractEventDefinition(
            new Event(DATA_SUBMITTED, List.of(
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Address>(true) {},
                    new TypeReference<Utf8String>() {},
                    new TypeReference<Uint256>() {})),
            List.of("submissionId", "contributor", "storageUrl", "preferredRewardChain"));

    public static final ContractEventDefinition VERIFICATION_COMPLETE_EVENT = new ContractEventDefinition(
            new Event(VERIFICATION_COMPLETE, List.of(
                    new TypeReference<Utf8String>(true) {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Bool>() {},
                    new TypeReference<Address>() {})),
            List.of("submissionId", "finalScore", "approved", "validator"));

    public static final ContractEventDefinition REWARD_DISTRIBUTED_EVENT = new ContractEventDefinition(
            new Event(REWARD_DISTRIBUTED, List.of(
                    new TypeReference<Address>(true) {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Address>() {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Uint256>() {})),
            List.of("recipient", "amount", "token", "sourceChain", "targetChain"));

    public static final ContractEventDefinition CROSS_CHAIN_OPERATION_COMPLETE_EVENT = new ContractEventDefinition(
            new Event(CROSS_CHAIN_OPERATION_COMPLETE, List.of(
                    new TypeReference<Bytes32>(true) {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Uint256>() {},
                    new TypeReference<Bool>() {})),
            List.of("operationId", "sourceChain", "targetChain", "success"));

    public static final List<ContractEventDefinition> ALL = List.of(
            TASK_CREATED_EVENT,
            DATA_SUBMITTED_EVENT,
            VERIFICATION_COMPLETE_EVENT,
            REWARD_DISTRIBUTED_EVENT,
            CROSS_CHAIN_OPERATION_COMPLETE_EVENT);

    private UniversalContractEvents() {
    }

    public static List<String> topics() {
        return ALL.stream().map(ContractEventDefinition::topic).toList();
    }
}
