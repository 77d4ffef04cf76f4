package com.autorestake.web3.dto;

import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;

import java.util.List;

/**
 * A contract call: target address plus ABI function.
 */
public record CallDescriptor(String contractAddress, Function function) {

    public static CallDescriptor of(String contractAddress, String name, List<Type> inputs, List<TypeReference<?>> outputs) {
        return new CallDescriptor(contractAddress, new Function(name, inputs, outputs));
    }

    public String name() {
        return function.getName();
    }
}
