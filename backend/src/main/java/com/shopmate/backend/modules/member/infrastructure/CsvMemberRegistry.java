package com.shopmate.backend.modules.member.infrastructure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.shopmate.backend.modules.member.domain.Member;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Member directory backed by {@code members.csv}. The file is re-read whenever its
 * modification time changes, so edits made while the service runs take effect on the
 * next command. A missing file means an empty registry.
 */
@Component
public class CsvMemberRegistry implements MemberRegistry {

    private static final Logger log = LoggerFactory.getLogger(CsvMemberRegistry.class);

    private final Path membersFile;
    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();

    private FileTime loadedAt;
    private List<Member> members = List.of();

    public CsvMemberRegistry(@Value("${shopmate.members.path:members.csv}") Path membersFile) {
        this.membersFile = membersFile;
    }

    @Override
    public Optional<Member> findByHandle(String handle) {
        if (handle == null || handle.isBlank()) {
            return Optional.empty();
        }
        String key = handle.trim();
        return all().stream().filter(member -> member.handle().equals(key)).findFirst();
    }

    @Override
    public Optional<Member> findByCardUid(String cardUid) {
        String key = Member.normalizeCardUid(cardUid);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return all().stream().filter(member -> member.cardUid().equals(key)).findFirst();
    }

    @Override
    public Optional<Member> findByName(String name) {
        return all().stream().filter(member -> member.hasName(name)).findFirst();
    }

    @Override
    public synchronized List<Member> all() {
        if (!Files.exists(membersFile)) {
            if (loadedAt != null || !members.isEmpty()) {
                log.warn("Member registry {} disappeared; treating registry as empty", membersFile);
            }
            loadedAt = null;
            members = List.of();
            return members;
        }
        try {
            FileTime modified = Files.getLastModifiedTime(membersFile);
            if (!modified.equals(loadedAt)) {
                members = load();
                loadedAt = modified;
                log.info("Loaded {} members from {}", members.size(), membersFile);
            }
        } catch (IOException ex) {
            log.error("Failed to read member registry {}; keeping {} previously loaded members",
                    membersFile, members.size(), ex);
        }
        return members;
    }

    private List<Member> load() throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Map<String, Member> byHandle = new LinkedHashMap<>();
        try (MappingIterator<MemberCsvRow> rows = csvMapper.readerFor(MemberCsvRow.class)
                .with(schema)
                .readValues(membersFile.toFile())) {
            while (rows.hasNext()) {
                MemberCsvRow row = rows.next();
                if (isBlank(row.handle()) || isBlank(row.memberName())) {
                    log.warn("Skipping member row without handle or name: {}", row);
                    continue;
                }
                Member member = new Member(
                        row.handle().trim(),
                        row.memberName().trim(),
                        row.cardUid(),
                        Member.parseSeniority(row.seniority()),
                        row.leadHandle()
                );
                if (byHandle.putIfAbsent(member.handle(), member) != null) {
                    log.warn("Duplicate member handle {} in {}; keeping the first row", member.handle(), membersFile);
                }
            }
        }
        return List.copyOf(byHandle.values());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
