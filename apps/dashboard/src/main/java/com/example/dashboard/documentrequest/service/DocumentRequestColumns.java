package com.example.dashboard.documentrequest.service;

import com.example.dashboard.column.TableColumns;
import com.example.dashboard.documentrequest.model.DocumentRequest;
import com.example.dashboard.table.model.TableColumn;

import java.util.List;

public final class DocumentRequestColumns {

    public static final String STATUS_BADGE_TYPE = "documentRequest";

    private DocumentRequestColumns() {}

    public static List<TableColumn<DocumentRequest>> all() {
        return List.of(
                TableColumns.<DocumentRequest>numeric("id", "ID").toBuilder().width("80px").build(),
                TableColumns.<DocumentRequest>text("sourceSystem.refDataValue", "Source System")
                        .toBuilder().width("140px").build(),
                TableColumns.<DocumentRequest>text("documentType.refDataValue", "Document Type")
                        .toBuilder().width("140px").build(),
                TableColumns.<DocumentRequest>text("documentName.refDataValue", "Document Name")
                        .toBuilder().width("180px").build(),
                TableColumns.<DocumentRequest>status("documentStatus.refDataValue", "Status", STATUS_BADGE_TYPE,
                        row -> row.documentStatus().refDataValue(),
                        row -> row.documentStatus().description()),
                TableColumns.<DocumentRequest>dateTime("createdDat", "Created").toBuilder().width("160px").build(),
                TableColumns.<DocumentRequest>dateTime("lastUpdateDat", "Last Updated")
                        .toBuilder().width("160px").build());
    }
}
