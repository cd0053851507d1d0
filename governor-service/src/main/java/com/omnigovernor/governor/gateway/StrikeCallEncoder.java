package com.omnigovernor.governor.gateway;

import com.omnigovernor.common.model.StrikeAction;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;

import java.util.Collections;
import java.util.List;

/**
 * ABI encoding of {@code executeComplexPath(string[] path, uint256 amount)}.
 */
public final class StrikeCallEncoder {

    private StrikeCallEncoder() {}

    public static String encode(StrikeAction action) {
        List<Utf8String> path = action.path().stream().map(Utf8String::new).toList();
        Function function = new Function(
            action.operation(),
            List.<Type>of(new DynamicArray<>(Utf8String.class, path), new Uint256(action.amount())),
            Collections.emptyList());
        return FunctionEncoder.encode(function);
    }
}
