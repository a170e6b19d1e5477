package ir.ipaam.receiptservice.api.mapper;

import ir.ipaam.receiptservice.domain.model.valueobject.DonorRecord;

import java.util.List;
import java.util.Map;

public final class DonorRecordMapper {
    private DonorRecordMapper() {}

    public static DonorRecord toDonor(Map<String, ?> row) {
        return DonorRecord.of(row);
    }

    public static List<DonorRecord> toDonors(List<? extends Map<String, ?>> rows) {
        return rows.stream().map(DonorRecordMapper::toDonor).toList();
    }
}
