package com.coinledger.api.validation;

import com.coinledger.domain.ChainId;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Address and chain id rules of an analysis submission, shared by the Bean Validation constraints.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    /** P2PKH / P2SH, Base58. */
    private static final Pattern BTC_LEGACY = Pattern.compile("^[13][a-km-zA-HJ-NP-Z1-9]{25,34}$");
    /** SegWit v0 and Taproot, bech32 / bech32m; mixed case is invalid. */
    private static final Pattern BTC_BECH32 = Pattern.compile("^bc1[02-9ac-hj-np-z]{11,87}$");
    private static final Pattern SEPARATORS = Pattern.compile("[,;\\s]+");

    static final List<ChainId> DEFAULT_CHAINS = List.of(ChainId.ETHEREUM);

    public boolean isValidBitcoinAddress(String address) {
        if (address == null || address.isBlank()) return false;
        String a = address.strip();
        if (BTC_LEGACY.matcher(a).matches()) return true;
        boolean singleCase = a.equals(a.toLowerCase(Locale.ROOT)) || a.equals(a.toUpperCase(Locale.ROOT));
        return singleCase && BTC_BECH32.matcher(a.toLowerCase(Locale.ROOT)).matches();
    }

    public boolean isValidEvmAddress(String address) {
        return address != null && EVM_ADDRESS.matcher(address.strip()).matches();
    }

    public boolean isSupportedEvmNetwork(String id) {
        return id != null && ChainId.fromId(id.strip()).filter(ChainId::isAccountBased).isPresent();
    }

    /**
     * Repeated or comma separated chain ids; none given means Ethereum only.
     *
     * @throws InvalidAnalysisRequestException INVALID_NETWORK for unknown or non-EVM chain ids
     */
    public List<ChainId> evmChains(List<String> fields) {
        List<String> ids = split(fields);
        if (ids.isEmpty()) {
            return DEFAULT_CHAINS;
        }
        List<ChainId> chains = new ArrayList<>();
        for (String id : ids) {
            Optional<ChainId> chain = ChainId.fromId(id).filter(ChainId::isAccountBased);
            if (chain.isEmpty()) {
                throw new InvalidAnalysisRequestException(InvalidAnalysisRequestException.INVALID_NETWORK,
                        "Unsupported EVM network: " + id);
            }
            if (!chains.contains(chain.get())) {
                chains.add(chain.get());
            }
        }
        return chains;
    }

    /**
     * Splits comma, semicolon or whitespace separated fields; blanks and duplicates are dropped.
     */
    public List<String> split(List<String> fields) {
        Set<String> values = new LinkedHashSet<>();
        if (fields == null) return List.of();
        for (String field : fields) {
            if (field == null) continue;
            for (String v : SEPARATORS.split(field.strip())) {
                if (!v.isBlank()) values.add(v.strip());
            }
        }
        return List.copyOf(values);
    }
}
