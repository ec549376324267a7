package io.jobplan4j.internal.json;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON document model for a scheduling problem.
 *
 * <pre>{@code
 * {
 *   "machines": [{"id": "A", "capacity": 1}],
 *   "jobs": [{"id": "1", "processingTime": 8, "requiredMachines": ["A"], "dependsOn": []}],
 *   "dependencies": [{"predecessor": "1", "successor": "4"}]
 * }
 * }</pre>
 */
public class ProblemDocument {

    private List<MachineEntry> machines = new ArrayList<>();
    private List<JobEntry> jobs = new ArrayList<>();
    private List<DependencyEntry> dependencies = new ArrayList<>();

    public ProblemDocument() {
    }

    public List<MachineEntry> getMachines() {
        return machines;
    }

    public void setMachines(List<MachineEntry> machines) {
        this.machines = machines;
    }

    public List<JobEntry> getJobs() {
        return jobs;
    }

    public void setJobs(List<JobEntry> jobs) {
        this.jobs = jobs;
    }

    public List<DependencyEntry> getDependencies() {
        return dependencies;
    }

    public void setDependencies(List<DependencyEntry> dependencies) {
        this.dependencies = dependencies;
    }

    public static class MachineEntry {
        private String id;
        // absent in JSON means 1
        private int capacity = 1;

        public MachineEntry() {
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class JobEntry {
        private String id;
        private long processingTime;
        private List<String> requiredMachines = new ArrayList<>();
        private List<String> dependsOn = new ArrayList<>();

        public JobEntry() {
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public long getProcessingTime() {
            return processingTime;
        }

        public void setProcessingTime(long processingTime) {
            this.processingTime = processingTime;
        }

        public List<String> getRequiredMachines() {
            return requiredMachines;
        }

        public void setRequiredMachines(List<String> requiredMachines) {
            this.requiredMachines = requiredMachines;
        }

        public List<String> getDependsOn() {
            return dependsOn;
        }

        public void setDependsOn(List<String> dependsOn) {
            this.dependsOn = dependsOn;
        }
    }

    public static class DependencyEntry {
        private String predecessor;
        private String successor;

        public DependencyEntry() {
        }

        public String getPredecessor() {
            return predecessor;
        }

        public void setPredecessor(String predecessor) {
            this.predecessor = predecessor;
        }

        public String getSuccessor() {
            return successor;
        }

        public void setSuccessor(String successor) {
            this.successor = successor;
        }
    }
}
