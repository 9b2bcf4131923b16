package com.sommerph.attestbackend.service.registry;

import com.sommerph.attestbackend.exception.ProtocolError;
import com.sommerph.attestbackend.exception.ProtocolException;
import com.sommerph.attestbackend.service.hub.VoucherHubService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class InProcessVoucherHubClient implements VoucherHubClient {

    private final VoucherHubService voucherHub;

    @Override
    public VoucherCreationResult createVoucher(String hubAddress, String registryAddress, String qHash,
                                               List<Long> targetChainIds, String verifierId) {
        if (hubAddress == null || !hubAddress.equalsIgnoreCase(voucherHub.getAddress())) {
            log.warn("No voucher hub deployed at {}", hubAddress);
            return unavailable("no voucher hub at " + hubAddress);
        }
        try {
            return VoucherCreationResult.created(
                    voucherHub.createVoucher(registryAddress, qHash, targetChainIds, verifierId));
        } catch (ProtocolException e) {
            log.warn("Voucher hub rejected voucher for qHash {}: {}", qHash, e.getMessage());
            return VoucherCreationResult.failed(e.getError().getCode() + " " + e.getError().getMessage());
        } catch (RuntimeException e) {
            log.error("Voucher hub call failed for qHash {}", qHash, e);
            return unavailable(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static VoucherCreationResult unavailable(String detail) {
        ProtocolError error = ProtocolError.VOUCHER_HUB_UNAVAILABLE;
        return VoucherCreationResult.failed(error.getCode() + " " + error.getMessage() + ": " + detail);
    }

}
