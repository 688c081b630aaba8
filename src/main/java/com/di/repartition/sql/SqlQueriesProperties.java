package com.di.repartition.sql;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Catalog SQL loaded from sql-queries.yml (repartition.sql.*).
 * No catalog SQL is hardcoded in the readers and checks; they use these named queries.
 */
@Component
@ConfigurationProperties(prefix = "repartition.sql")
public class SqlQueriesProperties {

    private Discovery discovery = new Discovery();
    private Validation validation = new Validation();
    private Verify verify = new Verify();

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }
    public Validation getValidation() { return validation; }
    public void setValidation(Validation validation) { this.validation = validation; }
    public Verify getVerify() { return verify; }
    public void setVerify(Verify verify) { this.verify = verify; }

    /** Schema discovery: schema-wide aggregates plus the per-table detail queries. */
    public static class Discovery {
        private String tablesBase;
        private String tablesIncludeFilter;
        private String tablesExcludeFilter;
        private String tablesOrder;
        private String partitionState;
        private String tableSizes;
        private String tableStats;
        private String lobCounts;
        private String indexCounts;
        private String partitionKeys;
        private String timestampColumns;
        private String numericColumns;
        private String stringColumns;
        private String identityColumns;
        private String columns;
        private String lobStorage;
        private String storageParameters;
        private String indexColumns;
        private String indexes;
        private String indexLocality;
        private String grants;

        public String getTablesBase() { return tablesBase; }
        public void setTablesBase(String tablesBase) { this.tablesBase = tablesBase; }
        public String getTablesIncludeFilter() { return tablesIncludeFilter; }
        public void setTablesIncludeFilter(String tablesIncludeFilter) { this.tablesIncludeFilter = tablesIncludeFilter; }
        public String getTablesExcludeFilter() { return tablesExcludeFilter; }
        public void setTablesExcludeFilter(String tablesExcludeFilter) { this.tablesExcludeFilter = tablesExcludeFilter; }
        public String getTablesOrder() { return tablesOrder; }
        public void setTablesOrder(String tablesOrder) { this.tablesOrder = tablesOrder; }
        public String getPartitionState() { return partitionState; }
        public void setPartitionState(String partitionState) { this.partitionState = partitionState; }
        public String getTableSizes() { return tableSizes; }
        public void setTableSizes(String tableSizes) { this.tableSizes = tableSizes; }
        public String getTableStats() { return tableStats; }
        public void setTableStats(String tableStats) { this.tableStats = tableStats; }
        public String getLobCounts() { return lobCounts; }
        public void setLobCounts(String lobCounts) { this.lobCounts = lobCounts; }
        public String getIndexCounts() { return indexCounts; }
        public void setIndexCounts(String indexCounts) { this.indexCounts = indexCounts; }
        public String getPartitionKeys() { return partitionKeys; }
        public void setPartitionKeys(String partitionKeys) { this.partitionKeys = partitionKeys; }
        public String getTimestampColumns() { return timestampColumns; }
        public void setTimestampColumns(String timestampColumns) { this.timestampColumns = timestampColumns; }
        public String getNumericColumns() { return numericColumns; }
        public void setNumericColumns(String numericColumns) { this.numericColumns = numericColumns; }
        public String getStringColumns() { return stringColumns; }
        public void setStringColumns(String stringColumns) { this.stringColumns = stringColumns; }
        public String getIdentityColumns() { return identityColumns; }
        public void setIdentityColumns(String identityColumns) { this.identityColumns = identityColumns; }
        public String getColumns() { return columns; }
        public void setColumns(String columns) { this.columns = columns; }
        public String getLobStorage() { return lobStorage; }
        public void setLobStorage(String lobStorage) { this.lobStorage = lobStorage; }
        public String getStorageParameters() { return storageParameters; }
        public void setStorageParameters(String storageParameters) { this.storageParameters = storageParameters; }
        public String getIndexColumns() { return indexColumns; }
        public void setIndexColumns(String indexColumns) { this.indexColumns = indexColumns; }
        public String getIndexes() { return indexes; }
        public void setIndexes(String indexes) { this.indexes = indexes; }
        public String getIndexLocality() { return indexLocality; }
        public void setIndexLocality(String indexLocality) { this.indexLocality = indexLocality; }
        public String getGrants() { return grants; }
        public void setGrants(String grants) { this.grants = grants; }
    }

    /** Live-database tier of the configuration validator. */
    public static class Validation {
        private String tableExists;
        private String columnDefinition;

        public String getTableExists() { return tableExists; }
        public void setTableExists(String tableExists) { this.tableExists = tableExists; }
        public String getColumnDefinition() { return columnDefinition; }
        public void setColumnDefinition(String columnDefinition) { this.columnDefinition = columnDefinition; }
    }

    /**
     * Pre/post-migration and data comparison checks. {@code rowCount}, {@code sampleKeys},
     * {@code sampleMatch} and {@code minMax} are format templates over validated identifiers.
     */
    public static class Verify {
        private String tableExists;
        private String columnsPresent;
        private String columnType;
        private String freeSpaceDba;
        private String freeSpaceUser;
        private String tableLocks;
        private String foreignKeys;
        private String partitionState;
        private String indexCount;
        private String constraints;
        private String primaryKeyColumns;
        private String rowCount;
        private String sampleKeys;
        private String sampleMatch;
        private String minMax;
        private String partitionDistribution;

        public String getTableExists() { return tableExists; }
        public void setTableExists(String tableExists) { this.tableExists = tableExists; }
        public String getColumnsPresent() { return columnsPresent; }
        public void setColumnsPresent(String columnsPresent) { this.columnsPresent = columnsPresent; }
        public String getColumnType() { return columnType; }
        public void setColumnType(String columnType) { this.columnType = columnType; }
        public String getFreeSpaceDba() { return freeSpaceDba; }
        public void setFreeSpaceDba(String freeSpaceDba) { this.freeSpaceDba = freeSpaceDba; }
        public String getFreeSpaceUser() { return freeSpaceUser; }
        public void setFreeSpaceUser(String freeSpaceUser) { this.freeSpaceUser = freeSpaceUser; }
        public String getTableLocks() { return tableLocks; }
        public void setTableLocks(String tableLocks) { this.tableLocks = tableLocks; }
        public String getForeignKeys() { return foreignKeys; }
        public void setForeignKeys(String foreignKeys) { this.foreignKeys = foreignKeys; }
        public String getPartitionState() { return partitionState; }
        public void setPartitionState(String partitionState) { this.partitionState = partitionState; }
        public String getIndexCount() { return indexCount; }
        public void setIndexCount(String indexCount) { this.indexCount = indexCount; }
        public String getConstraints() { return constraints; }
        public void setConstraints(String constraints) { this.constraints = constraints; }
        public String getPrimaryKeyColumns() { return primaryKeyColumns; }
        public void setPrimaryKeyColumns(String primaryKeyColumns) { this.primaryKeyColumns = primaryKeyColumns; }
        public String getRowCount() { return rowCount; }
        public void setRowCount(String rowCount) { this.rowCount = rowCount; }
        public String getSampleKeys() { return sampleKeys; }
        public void setSampleKeys(String sampleKeys) { this.sampleKeys = sampleKeys; }
        public String getSampleMatch() { return sampleMatch; }
        public void setSampleMatch(String sampleMatch) { this.sampleMatch = sampleMatch; }
        public String getMinMax() { return minMax; }
        public void setMinMax(String minMax) { this.minMax = minMax; }
        public String getPartitionDistribution() { return partitionDistribution; }
        public void setPartitionDistribution(String partitionDistribution) { this.partitionDistribution = partitionDistribution; }
    }
}
